package com.eurofolio.engine.application.backtest.dto;

import com.eurofolio.engine.application.backtest.engine.dto.RebalanceFrequency;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class PortfolioBacktestRequest {

    private LocalDate startDate;
    private LocalDate endDate;
    private BigDecimal initialInvestment = new BigDecimal("10000"); // 기본값 10,000
    private RebalanceFrequency rebalanceFrequency = RebalanceFrequency.ANNUALLY;

    public PortfolioBacktestRequest(LocalDate startDate, LocalDate endDate) {
        this.startDate = startDate;
        this.endDate = endDate;
    }
}
