package com.eurofolio.engine.application.backtest.engine.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 최고/최저 월 수익률
 * - date는 월 순위에 비례한 시계열 인덱스의 근사 날짜 (범위를 벗어나면 null)
 */
@Getter
@ToString
@AllArgsConstructor
public class MonthHighlight {

    private final LocalDate date;
    private final BigDecimal returnRate;

    public static MonthHighlight none() {
        return new MonthHighlight(null, BigDecimal.ZERO);
    }
}
