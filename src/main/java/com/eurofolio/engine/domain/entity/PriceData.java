package com.eurofolio.engine.domain.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 자산별 일봉 시세 (외부 시세 API 응답의 로컬 캐시)
 */
@Entity
@Table(name = "price_data", uniqueConstraints = {
    @UniqueConstraint(name = "uk_price_asset_date", columnNames = {"asset_id", "trade_date"})
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PriceData {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "asset_id", nullable = false)
    private Asset asset;

    @Column(name = "trade_date", nullable = false)
    private LocalDate tradeDate;

    @Column(precision = 30, scale = 8)
    private BigDecimal openPrice;

    @Column(precision = 30, scale = 8)
    private BigDecimal highPrice;

    @Column(precision = 30, scale = 8)
    private BigDecimal lowPrice;

    @Column(nullable = false, precision = 30, scale = 8)
    private BigDecimal closePrice;

    @Column(precision = 30, scale = 8)
    private BigDecimal adjustedClose;

    private Long volume;

    private PriceData(Asset asset, LocalDate tradeDate, BigDecimal openPrice, BigDecimal highPrice,
                      BigDecimal lowPrice, BigDecimal closePrice, BigDecimal adjustedClose, Long volume) {
        this.asset = asset;
        this.tradeDate = tradeDate;
        this.openPrice = openPrice;
        this.highPrice = highPrice;
        this.lowPrice = lowPrice;
        this.closePrice = closePrice;
        this.adjustedClose = adjustedClose;
        this.volume = volume;
    }

    public static PriceData of(Asset asset, LocalDate tradeDate, BigDecimal openPrice, BigDecimal highPrice,
                               BigDecimal lowPrice, BigDecimal closePrice, BigDecimal adjustedClose, Long volume) {
        return new PriceData(asset, tradeDate, openPrice, highPrice, lowPrice, closePrice, adjustedClose, volume);
    }
}
