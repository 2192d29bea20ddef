package com.eurofolio.engine.application.dto;

import com.eurofolio.engine.domain.entity.Asset;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class AssetResponse {

    private final Long id;
    private final String symbol;
    private final String exchange;
    private final String ticker;
    private final String name;
    private final String currency;
    private final Asset.AssetType type;
    private final Boolean active;

    public static AssetResponse from(Asset asset) {
        return new AssetResponse(
            asset.getId(),
            asset.getSymbol(),
            asset.getExchange(),
            asset.getTicker(),
            asset.getName(),
            asset.getCurrency(),
            asset.getType(),
            asset.getIsActive()
        );
    }
}
