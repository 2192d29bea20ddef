package com.eurofolio.engine.application.backtest.engine.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * 백테스트 1회 실행 결과
 * - 입력 파라미터 + 성과 지표 + 일별 평가 시계열
 */
@Getter
@AllArgsConstructor
@Builder
public class BacktestResult {

    private final Long portfolioId;
    private final LocalDate startDate;
    private final LocalDate endDate;
    private final BigDecimal initialInvestment;
    private final RebalanceFrequency rebalanceFrequency;

    private final BigDecimal finalValue;
    private final int totalDays;

    private final PerformanceMetrics metrics;
    private final List<PerformancePoint> performanceData;
}
