package com.eurofolio.engine.domain.entity;

import com.eurofolio.engine.domain.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * 포트폴리오 (자산별 목표 비중의 묶음)
 */
@Entity
@Table(name = "portfolios")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Portfolio extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "portfolio_id")
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 500)
    private String description;

    @Column(nullable = false, length = 16)
    private String rebalanceFrequency; // NEVER, MONTHLY, QUARTERLY, ANNUALLY

    @Column(nullable = false)
    private Boolean isPublic;

    @OneToMany(mappedBy = "portfolio", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<PortfolioAllocation> allocations = new ArrayList<>();

    private Portfolio(String name, String description, String rebalanceFrequency, Boolean isPublic) {
        this.name = name;
        this.description = description;
        this.rebalanceFrequency = rebalanceFrequency;
        this.isPublic = isPublic != null ? isPublic : false;
    }

    public static Portfolio create(String name, String description, String rebalanceFrequency, Boolean isPublic) {
        return new Portfolio(name, description, rebalanceFrequency, isPublic);
    }

    public PortfolioAllocation addAllocation(Asset asset, BigDecimal percentage) {
        PortfolioAllocation allocation = PortfolioAllocation.of(this, asset, percentage);
        this.allocations.add(allocation);
        return allocation;
    }
}
