package com.eurofolio.engine.application.backtest.dto;

import com.eurofolio.engine.application.backtest.engine.dto.RebalanceFrequency;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * 배치 백테스트 요청 (포트폴리오 × 리밸런싱 주기 조합을 모두 실행)
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class BatchBacktestRequest {

    private List<Long> portfolioIds = new ArrayList<>();
    private List<RebalanceFrequency> rebalanceFrequencies = new ArrayList<>(List.of(RebalanceFrequency.ANNUALLY));
    private LocalDate startDate;
    private LocalDate endDate;
    private BigDecimal initialInvestment = new BigDecimal("10000");
}
