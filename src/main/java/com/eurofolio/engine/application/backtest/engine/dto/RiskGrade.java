package com.eurofolio.engine.application.backtest.engine.dto;

import java.math.BigDecimal;

/**
 * Sharpe Ratio 기반 위험 조정 수익 등급
 */
public enum RiskGrade {

    A_PLUS("A+", "Excellent", new BigDecimal("2.0")),
    A("A", "Very Good", new BigDecimal("1.5")),
    B_PLUS("B+", "Good", new BigDecimal("1.0")),
    B("B", "Fair", new BigDecimal("0.5")),
    C("C", "Poor", BigDecimal.ZERO),
    D("D", "Very Poor", null);

    private final String grade;
    private final String description;
    private final BigDecimal minSharpe;

    RiskGrade(String grade, String description, BigDecimal minSharpe) {
        this.grade = grade;
        this.description = description;
        this.minSharpe = minSharpe;
    }

    public String getGrade() {
        return grade;
    }

    public String getDescription() {
        return description;
    }

    public static RiskGrade fromSharpe(BigDecimal sharpeRatio) {
        for (RiskGrade riskGrade : values()) {
            if (riskGrade.minSharpe != null && sharpeRatio.compareTo(riskGrade.minSharpe) >= 0) {
                return riskGrade;
            }
        }
        return D;
    }
}
