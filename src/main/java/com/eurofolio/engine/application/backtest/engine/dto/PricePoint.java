package com.eurofolio.engine.application.backtest.engine.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;

@Getter
@ToString
@AllArgsConstructor
public class PricePoint {

    private final LocalDate date;
    private final BigDecimal closePrice;

    public static PricePoint of(LocalDate date, String closePrice) {
        return new PricePoint(date, new BigDecimal(closePrice));
    }
}
