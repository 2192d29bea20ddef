package com.eurofolio.engine.application.backtest.dto;

import com.eurofolio.engine.application.backtest.engine.dto.BacktestResult;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * 포트폴리오 백테스트 응답
 * 엔진 결과 필드를 최상위에 펼치고 저장 ID와 데이터 충족률을 덧붙인다.
 */
@Getter
@Builder
@AllArgsConstructor
public class PortfolioBacktestResponse {

    @JsonUnwrapped
    private final BacktestResult result;

    private final Long backtestId; // 저장 실패 시 null
    private final PortfolioSummary portfolio;
    private final int assetsAnalyzed;
    private final int totalAssets;
    private final BigDecimal dataCompleteness; // assetsAnalyzed / totalAssets

    public record PortfolioSummary(Long id, String name, String description) {}
}
