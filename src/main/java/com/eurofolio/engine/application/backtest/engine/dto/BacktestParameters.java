package com.eurofolio.engine.application.backtest.engine.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 백테스트 실행 파라미터
 */
@Getter
@ToString
@AllArgsConstructor
@Builder
public class BacktestParameters {

    private final Long portfolioId;
    private final LocalDate startDate;
    private final LocalDate endDate;
    private final BigDecimal initialInvestment;

    @Builder.Default
    private final RebalanceFrequency rebalanceFrequency = RebalanceFrequency.NEVER;
}
