package com.eurofolio.engine.application.backtest;

import com.eurofolio.engine.application.PriceDataService;
import com.eurofolio.engine.application.backtest.dto.BacktestRecordResponse;
import com.eurofolio.engine.application.backtest.dto.PortfolioBacktestRequest;
import com.eurofolio.engine.application.backtest.dto.PortfolioBacktestResponse;
import com.eurofolio.engine.application.backtest.engine.BacktestEngine;
import com.eurofolio.engine.application.backtest.engine.BacktestValidationException;
import com.eurofolio.engine.application.backtest.engine.MissingPriceDataException;
import com.eurofolio.engine.application.backtest.engine.dto.Allocation;
import com.eurofolio.engine.application.backtest.engine.dto.BacktestParameters;
import com.eurofolio.engine.application.backtest.engine.dto.BacktestResult;
import com.eurofolio.engine.application.backtest.engine.dto.PerformanceMetrics;
import com.eurofolio.engine.application.backtest.engine.dto.PricePoint;
import com.eurofolio.engine.application.backtest.engine.dto.PriceSeries;
import com.eurofolio.engine.application.backtest.engine.dto.RebalanceFrequency;
import com.eurofolio.engine.domain.entity.BacktestRecord;
import com.eurofolio.engine.domain.entity.Portfolio;
import com.eurofolio.engine.domain.entity.PortfolioAllocation;
import com.eurofolio.engine.domain.repository.BacktestRecordRepository;
import com.eurofolio.engine.domain.repository.PortfolioRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 저장된 포트폴리오로 백테스트 실행
 * - 기간 내 시세가 없는 자산은 제외하고, 남은 자산 비중을 100%로 재조정
 * - 실행 요약은 backtest_results에 저장 (저장 실패해도 결과는 반환)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PortfolioBacktestService {

    private static final BigDecimal DEFAULT_INITIAL_INVESTMENT = new BigDecimal("10000");
    private static final BigDecimal HUNDRED = new BigDecimal("100");
    private static final int SCALE = 8;

    private final PortfolioRepository portfolioRepository;
    private final BacktestRecordRepository backtestRecordRepository;
    private final PriceDataService priceDataService;
    private final BacktestEngine backtestEngine;

    public PortfolioBacktestResponse runBacktest(Long portfolioId, PortfolioBacktestRequest request) {
        return runBacktest(portfolioId, request, null);
    }

    /**
     * @param jobId 배치 실행이면 작업 ID, 단건 실행이면 null
     */
    public PortfolioBacktestResponse runBacktest(Long portfolioId, PortfolioBacktestRequest request, String jobId) {
        // 1. 요청 검증 및 기본값
        if (request.getStartDate() == null || request.getEndDate() == null) {
            throw new BacktestValidationException("startDate and endDate are required");
        }
        if (!request.getStartDate().isBefore(request.getEndDate())) {
            throw new BacktestValidationException("Start date must be before end date");
        }
        BigDecimal initialInvestment = request.getInitialInvestment() != null
            ? request.getInitialInvestment()
            : DEFAULT_INITIAL_INVESTMENT;
        RebalanceFrequency frequency = request.getRebalanceFrequency() != null
            ? request.getRebalanceFrequency()
            : RebalanceFrequency.ANNUALLY;

        // 2. 포트폴리오 로딩
        Portfolio portfolio = portfolioRepository.findWithAllocationsById(portfolioId)
            .orElseThrow(() -> new IllegalArgumentException("Portfolio not found: " + portfolioId));
        List<PortfolioAllocation> allocations = portfolio.getAllocations();
        if (allocations.isEmpty()) {
            throw new BacktestValidationException("Portfolio has no asset allocations");
        }

        // 3. 자산별 시세 로딩 (없는 자산은 제외)
        Map<String, PriceSeries> priceSeriesByAsset = new HashMap<>();
        List<PortfolioAllocation> allocationsWithData = new ArrayList<>();
        for (PortfolioAllocation allocation : allocations) {
            List<PricePoint> prices = priceDataService.getPriceSeries(
                allocation.getAsset(), request.getStartDate(), request.getEndDate());
            if (prices.isEmpty()) {
                log.warn("기간 내 시세 없음, 제외: portfolio={}, asset={}",
                    portfolioId, allocation.getAsset().getTicker());
                continue;
            }
            PriceSeries series = PriceSeries.of(prices);
            log.debug("시세 로딩: asset={}, {}건 ({} ~ {})", allocation.getAsset().getTicker(), series.size(),
                series.firstDate().orElse(null), series.lastDate().orElse(null));
            priceSeriesByAsset.put(assetKey(allocation), series);
            allocationsWithData.add(allocation);
        }

        int totalAssets = allocations.size();
        int assetsAnalyzed = allocationsWithData.size();
        if (assetsAnalyzed == 0) {
            String assetIds = allocations.stream().map(this::assetKey).collect(Collectors.joining(","));
            throw new MissingPriceDataException(assetIds,
                "No price data available for any assets in the selected date range");
        }
        if (assetsAnalyzed < totalAssets) {
            log.warn("시세 보유 자산 {}/{}개만 분석: portfolio={}", assetsAnalyzed, totalAssets, portfolioId);
        }

        // 4. 남은 자산 비중 재조정 후 엔진 실행
        BacktestParameters params = BacktestParameters.builder()
            .portfolioId(portfolioId)
            .startDate(request.getStartDate())
            .endDate(request.getEndDate())
            .initialInvestment(initialInvestment)
            .rebalanceFrequency(frequency)
            .build();

        BacktestResult result = backtestEngine.runBacktest(
            renormalize(allocationsWithData), priceSeriesByAsset, params);

        // 5. 실행 요약 저장
        Long backtestId = saveRecord(result, jobId);

        return PortfolioBacktestResponse.builder()
            .result(result)
            .backtestId(backtestId)
            .portfolio(new PortfolioBacktestResponse.PortfolioSummary(
                portfolio.getId(), portfolio.getName(), portfolio.getDescription()))
            .assetsAnalyzed(assetsAnalyzed)
            .totalAssets(totalAssets)
            .dataCompleteness(BigDecimal.valueOf(assetsAnalyzed)
                .divide(BigDecimal.valueOf(totalAssets), 4, RoundingMode.HALF_UP))
            .build();
    }

    /**
     * 포트폴리오의 최근 백테스트 10건
     */
    @Transactional(readOnly = true)
    public List<BacktestRecordResponse> getBacktestHistory(Long portfolioId) {
        if (!portfolioRepository.existsById(portfolioId)) {
            throw new IllegalArgumentException("Portfolio not found: " + portfolioId);
        }
        return backtestRecordRepository.findTop10ByPortfolioIdOrderByCreatedAtDesc(portfolioId).stream()
            .map(BacktestRecordResponse::from)
            .collect(Collectors.toList());
    }

    private List<Allocation> renormalize(List<PortfolioAllocation> allocations) {
        BigDecimal available = allocations.stream()
            .map(PortfolioAllocation::getPercentage)
            .reduce(BigDecimal.ZERO, BigDecimal::add);

        return allocations.stream()
            .map(allocation -> new Allocation(
                assetKey(allocation),
                allocation.getPercentage().multiply(HUNDRED).divide(available, SCALE, RoundingMode.HALF_UP)))
            .collect(Collectors.toList());
    }

    private Long saveRecord(BacktestResult result, String jobId) {
        PerformanceMetrics metrics = result.getMetrics();
        BacktestRecord record = BacktestRecord.builder()
            .portfolioId(result.getPortfolioId())
            .jobId(jobId)
            .startDate(result.getStartDate())
            .endDate(result.getEndDate())
            .initialInvestment(result.getInitialInvestment())
            .rebalanceFrequency(result.getRebalanceFrequency().name())
            .finalValue(result.getFinalValue())
            .totalReturn(metrics.getTotalReturn())
            .annualizedReturn(metrics.getAnnualizedReturn())
            .volatility(metrics.getVolatility())
            .sharpeRatio(metrics.getSharpeRatio())
            .maxDrawdown(metrics.getMaxDrawdown())
            .bestYear(metrics.getBestYear())
            .worstYear(metrics.getWorstYear())
            .positiveMonths(metrics.getPositiveMonths())
            .negativeMonths(metrics.getNegativeMonths())
            .build();

        try {
            return backtestRecordRepository.save(record).getId();
        } catch (DataAccessException e) {
            log.error("백테스트 결과 저장 실패 (결과는 그대로 반환): portfolio={}", result.getPortfolioId(), e);
            return null;
        }
    }

    private String assetKey(PortfolioAllocation allocation) {
        return String.valueOf(allocation.getAsset().getId());
    }
}
