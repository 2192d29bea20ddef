package com.eurofolio.engine.application.backtest.dto;

import com.eurofolio.engine.domain.entity.BacktestRecord;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Getter
@AllArgsConstructor
public class BacktestRecordResponse {

    private final Long id;
    private final Long portfolioId;
    private final String jobId;
    private final LocalDate startDate;
    private final LocalDate endDate;
    private final BigDecimal initialInvestment;
    private final String rebalanceFrequency;
    private final BigDecimal finalValue;
    private final BigDecimal totalReturn;
    private final BigDecimal annualizedReturn;
    private final BigDecimal volatility;
    private final BigDecimal sharpeRatio;
    private final BigDecimal maxDrawdown;
    private final BigDecimal bestYear;
    private final BigDecimal worstYear;
    private final Integer positiveMonths;
    private final Integer negativeMonths;
    private final LocalDateTime createdAt;

    public static BacktestRecordResponse from(BacktestRecord record) {
        return new BacktestRecordResponse(
            record.getId(),
            record.getPortfolioId(),
            record.getJobId(),
            record.getStartDate(),
            record.getEndDate(),
            record.getInitialInvestment(),
            record.getRebalanceFrequency(),
            record.getFinalValue(),
            record.getTotalReturn(),
            record.getAnnualizedReturn(),
            record.getVolatility(),
            record.getSharpeRatio(),
            record.getMaxDrawdown(),
            record.getBestYear(),
            record.getWorstYear(),
            record.getPositiveMonths(),
            record.getNegativeMonths(),
            record.getCreatedAt()
        );
    }
}
