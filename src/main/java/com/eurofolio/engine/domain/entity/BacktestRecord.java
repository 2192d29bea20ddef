package com.eurofolio.engine.domain.entity;

import com.eurofolio.engine.domain.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 백테스트 실행 요약 (일별 시계열은 저장하지 않음)
 */
@Entity
@Table(name = "backtest_results", indexes = {
    @Index(name = "idx_backtest_portfolio", columnList = "portfolio_id"),
    @Index(name = "idx_backtest_job", columnList = "job_id")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BacktestRecord extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "result_id")
    private Long id;

    @Column(name = "portfolio_id", nullable = false)
    private Long portfolioId;

    @Column(name = "job_id", length = 64)
    private String jobId; // 배치 실행으로 생성된 경우에만

    @Column(nullable = false)
    private LocalDate startDate;

    @Column(nullable = false)
    private LocalDate endDate;

    @Column(nullable = false, precision = 30, scale = 8)
    private BigDecimal initialInvestment;

    @Column(nullable = false, length = 16)
    private String rebalanceFrequency;

    @Column(nullable = false, precision = 30, scale = 8)
    private BigDecimal finalValue;

    @Column(nullable = false, precision = 20, scale = 8)
    private BigDecimal totalReturn;

    @Column(nullable = false, precision = 20, scale = 8)
    private BigDecimal annualizedReturn;

    @Column(nullable = false, precision = 20, scale = 8)
    private BigDecimal volatility;

    @Column(nullable = false, precision = 20, scale = 8)
    private BigDecimal sharpeRatio;

    @Column(nullable = false, precision = 20, scale = 8)
    private BigDecimal maxDrawdown;

    @Column(precision = 20, scale = 8)
    private BigDecimal bestYear;

    @Column(precision = 20, scale = 8)
    private BigDecimal worstYear;

    @Column(nullable = false)
    private Integer positiveMonths;

    @Column(nullable = false)
    private Integer negativeMonths;

    @Builder
    public BacktestRecord(Long portfolioId, String jobId, LocalDate startDate, LocalDate endDate,
                          BigDecimal initialInvestment, String rebalanceFrequency, BigDecimal finalValue,
                          BigDecimal totalReturn, BigDecimal annualizedReturn, BigDecimal volatility,
                          BigDecimal sharpeRatio, BigDecimal maxDrawdown, BigDecimal bestYear,
                          BigDecimal worstYear, Integer positiveMonths, Integer negativeMonths) {
        this.portfolioId = portfolioId;
        this.jobId = jobId;
        this.startDate = startDate;
        this.endDate = endDate;
        this.initialInvestment = initialInvestment;
        this.rebalanceFrequency = rebalanceFrequency;
        this.finalValue = finalValue;
        this.totalReturn = totalReturn;
        this.annualizedReturn = annualizedReturn;
        this.volatility = volatility;
        this.sharpeRatio = sharpeRatio;
        this.maxDrawdown = maxDrawdown;
        this.bestYear = bestYear;
        this.worstYear = worstYear;
        this.positiveMonths = positiveMonths;
        this.negativeMonths = negativeMonths;
    }
}
