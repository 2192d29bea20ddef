package com.eurofolio.engine.application.backtest.engine.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

@Getter
@ToString
@AllArgsConstructor
@Builder
public class MonthlyReturn {

    private final int year;
    private final int month;
    private final String monthName; // Jan, Feb, ...
    private final BigDecimal returnRate; // 첫 달은 비교 대상이 없으므로 0
    private final BigDecimal value; // 해당 월 마지막 평가액
    private final int daysInMonth; // 시계열에 포함된 해당 월의 일수
}
