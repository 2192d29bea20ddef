package com.eurofolio.engine.application.backtest.engine.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 일별 포트폴리오 평가 결과 (달력일 기준, 휴일 포함)
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
@Builder
public class PerformancePoint {

    private final LocalDate date;
    private final BigDecimal value;
    private final BigDecimal dailyReturn;
    private final BigDecimal cumulativeReturn;
}
