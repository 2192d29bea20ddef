package com.eurofolio.engine.application.backtest.engine;

import com.eurofolio.engine.application.backtest.engine.dto.Allocation;
import com.eurofolio.engine.application.backtest.engine.dto.BacktestParameters;
import com.eurofolio.engine.application.backtest.engine.dto.BacktestResult;
import com.eurofolio.engine.application.backtest.engine.dto.NormalizedInput;
import com.eurofolio.engine.application.backtest.engine.dto.PerformanceMetrics;
import com.eurofolio.engine.application.backtest.engine.dto.PerformancePoint;
import com.eurofolio.engine.application.backtest.engine.dto.PriceSeries;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * 포트폴리오 백테스트 엔진
 * - 입력 검증 → 일별 평가 시뮬레이션 → 성과 지표 집계
 * - 상태를 갖지 않으므로 여러 백테스트를 동시에 실행해도 된다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BacktestEngine {

    private final BacktestInputNormalizer inputNormalizer;
    private final DailyValuationSimulator valuationSimulator;
    private final PerformanceMetricsCalculator metricsCalculator;

    public BacktestResult runBacktest(List<Allocation> allocations,
                                      Map<String, PriceSeries> priceSeriesByAsset,
                                      BacktestParameters params) {
        // 1. 입력 검증 (실패 시 시뮬레이션을 시작하지 않음)
        NormalizedInput input = inputNormalizer.normalize(allocations, priceSeriesByAsset, params);

        log.info("백테스트 시작: portfolio={}, {} ~ {}, 투자금={}, 리밸런싱={}, 자산 {}개",
            params.getPortfolioId(), params.getStartDate(), params.getEndDate(),
            params.getInitialInvestment(), params.getRebalanceFrequency(), input.getAllocations().size());

        // 2. 일별 평가
        List<LocalDate> dateRange = DailyValuationSimulator.dateRange(params.getStartDate(), params.getEndDate());
        List<PerformancePoint> performanceData = valuationSimulator.simulate(
            input.getAllocations(),
            input.getPriceSeriesByAsset(),
            dateRange,
            params.getInitialInvestment(),
            params.getRebalanceFrequency()
        );

        // 3. 성과 지표
        PerformanceMetrics metrics = metricsCalculator.aggregate(performanceData, params.getInitialInvestment());

        BigDecimal finalValue = performanceData.isEmpty()
            ? params.getInitialInvestment()
            : performanceData.get(performanceData.size() - 1).getValue();

        log.info("백테스트 완료: portfolio={}, 최종 평가액={}, 총수익률={}, MDD={}, Sharpe={}",
            params.getPortfolioId(), finalValue, metrics.getTotalReturn(), metrics.getMaxDrawdown(),
            metrics.getSharpeRatio());

        return BacktestResult.builder()
            .portfolioId(params.getPortfolioId())
            .startDate(params.getStartDate())
            .endDate(params.getEndDate())
            .initialInvestment(params.getInitialInvestment())
            .rebalanceFrequency(params.getRebalanceFrequency())
            .finalValue(finalValue)
            .totalDays(performanceData.size())
            .metrics(metrics)
            .performanceData(List.copyOf(performanceData))
            .build();
    }
}
