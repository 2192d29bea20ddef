package com.eurofolio.engine.domain.entity;

import com.eurofolio.engine.domain.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 투자 자산 (ETF, 주식, 채권, 지수)
 */
@Entity
@Table(name = "assets", uniqueConstraints = {
    @UniqueConstraint(name = "uk_asset_symbol_exchange", columnNames = {"symbol", "exchange"})
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Asset extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "asset_id")
    private Long id;

    @Column(nullable = false, length = 32)
    private String symbol; // 종목 코드 (예: VWCE)

    @Column(nullable = false, length = 16)
    private String exchange; // 거래소 코드 (예: XETRA)

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, length = 8)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "asset_type", nullable = false, length = 16)
    private AssetType type;

    @Column(nullable = false)
    private Boolean isActive;

    private Asset(String symbol, String exchange, String name, String currency, AssetType type) {
        this.symbol = symbol;
        this.exchange = exchange;
        this.name = name;
        this.currency = currency;
        this.type = type;
        this.isActive = true;
    }

    public static Asset of(String symbol, String exchange, String name, String currency, AssetType type) {
        return new Asset(symbol, exchange, name, currency, type);
    }

    /**
     * 시세 조회용 티커 (예: VWCE.XETRA)
     */
    public String getTicker() {
        return symbol + "." + exchange;
    }

    public enum AssetType {
        ETF,
        STOCK,
        BOND,
        INDEX
    }
}
