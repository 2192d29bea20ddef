package com.eurofolio.engine.application.backtest.engine;

/**
 * 편입 자산의 가격 데이터가 전혀 없을 때
 */
public class MissingPriceDataException extends IllegalStateException {

    private final String assetId;

    public MissingPriceDataException(String assetId) {
        super("No price data found for asset " + assetId);
        this.assetId = assetId;
    }

    public MissingPriceDataException(String assetId, String message) {
        super(message);
        this.assetId = assetId;
    }

    public String getAssetId() {
        return assetId;
    }
}
