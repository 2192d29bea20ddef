package com.eurofolio.engine.application.backtest.engine.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.List;

/**
 * 일별 평가 시계열로부터 계산한 성과 지표
 * - 수익률/낙폭/비율 값은 모두 소수 비율 (0.1 = 10%)
 */
@Getter
@ToString(exclude = {"drawdownPeriods", "monthlyReturns", "yearlyReturns"})
@AllArgsConstructor
@Builder
public class PerformanceMetrics {

    // 수익률
    private final BigDecimal totalReturn;
    private final BigDecimal annualizedReturn;

    // 위험 지표
    private final BigDecimal volatility;
    private final BigDecimal downsideDeviation;
    private final BigDecimal maxDrawdown;

    // 위험 조정 수익
    private final BigDecimal sharpeRatio;
    private final BigDecimal sortinoRatio;
    private final BigDecimal calmarRatio;
    private final BigDecimal recoveryFactor;
    private final RiskGrade riskGrade;

    // 낙폭 구간
    private final List<DrawdownPeriod> drawdownPeriods;
    private final BigDecimal averageDrawdownDuration;
    private final int maxDrawdownDuration;

    // 월/연 단위
    private final List<MonthlyReturn> monthlyReturns;
    private final List<YearlyReturn> yearlyReturns;
    private final int positiveMonths;
    private final int negativeMonths;
    private final BigDecimal winRate;
    private final MonthHighlight bestMonth;
    private final MonthHighlight worstMonth;
    private final BigDecimal bestYear; // 연간 수익률이 없으면 null
    private final BigDecimal worstYear;

    // 일 단위
    private final double gainToLossRatio; // 손실일이 없으면 Infinity
    private final BigDecimal uptimePercentage;
}
