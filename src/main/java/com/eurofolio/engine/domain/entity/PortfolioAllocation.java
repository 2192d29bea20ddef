package com.eurofolio.engine.domain.entity;

import com.eurofolio.engine.domain.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Entity
@Table(name = "portfolio_allocations", uniqueConstraints = {
    @UniqueConstraint(name = "uk_portfolio_asset", columnNames = {"portfolio_id", "asset_id"})
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PortfolioAllocation extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "allocation_id")
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "portfolio_id", nullable = false)
    private Portfolio portfolio;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "asset_id", nullable = false)
    private Asset asset;

    @Column(nullable = false, precision = 7, scale = 4)
    private BigDecimal percentage; // 목표 비중 (%)

    private PortfolioAllocation(Portfolio portfolio, Asset asset, BigDecimal percentage) {
        this.portfolio = portfolio;
        this.asset = asset;
        this.percentage = percentage;
    }

    static PortfolioAllocation of(Portfolio portfolio, Asset asset, BigDecimal percentage) {
        return new PortfolioAllocation(portfolio, asset, percentage);
    }
}
