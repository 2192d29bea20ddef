package com.eurofolio.engine.application.backtest.engine.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 낙폭 구간
 * - startDate: 직전 고점 날짜
 * - endDate: 회복일 (미회복 시 시계열 마지막 날짜)
 * - duration: 고점부터 회복(또는 마지막)까지의 일수
 */
@Getter
@ToString
@AllArgsConstructor
@Builder
public class DrawdownPeriod {

    private final LocalDate startDate;
    private final LocalDate endDate;
    private final BigDecimal peakValue;
    private final BigDecimal troughValue;
    private final BigDecimal drawdownPercentage;
    private final int duration;
    private final boolean recovered;
    private final LocalDate recoveryDate; // 미회복이면 null
}
