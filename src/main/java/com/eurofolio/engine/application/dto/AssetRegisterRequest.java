package com.eurofolio.engine.application.dto;

import com.eurofolio.engine.domain.entity.Asset;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class AssetRegisterRequest {

    private String symbol;   // 예: VWCE
    private String exchange; // 예: XETRA
    private String name;
    private String currency = "EUR";
    private Asset.AssetType type = Asset.AssetType.ETF;

    public AssetRegisterRequest(String symbol, String exchange, String name) {
        this.symbol = symbol;
        this.exchange = exchange;
        this.name = name;
    }
}
