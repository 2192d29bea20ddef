package com.eurofolio.engine.application.backtest;

import com.eurofolio.engine.application.backtest.dto.BatchBacktestRequest;
import com.eurofolio.engine.application.backtest.dto.PortfolioBacktestRequest;
import com.eurofolio.engine.application.backtest.dto.PortfolioBacktestResponse;
import com.eurofolio.engine.application.backtest.engine.dto.RebalanceFrequency;
import com.eurofolio.engine.domain.entity.BacktestJob;
import com.eurofolio.engine.domain.repository.BacktestJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * 배치 백테스트 실행기 (backtestExecutor 스레드에서 실행)
 * 개별 실행 실패는 실패 건수로만 집계하고 나머지 조합은 계속 실행한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BatchBacktestRunner {

    private final PortfolioBacktestService portfolioBacktestService;
    private final BacktestJobRepository jobRepository;

    @Async("backtestExecutor")
    public void runAsync(String jobId, BatchBacktestRequest request) {
        run(jobId, request);
    }

    void run(String jobId, BatchBacktestRequest request) {
        log.info("=== 배치 백테스트 시작: jobId={} ===", jobId);

        BacktestJob job = jobRepository.findById(jobId)
            .orElseThrow(() -> new IllegalArgumentException("Job not found: " + jobId));
        job.start();
        jobRepository.save(job);

        int totalRuns = job.getTotalRuns();
        int currentIndex = 0;

        try {
            for (Long portfolioId : request.getPortfolioIds()) {
                for (RebalanceFrequency frequency : request.getRebalanceFrequencies()) {
                    currentIndex++;
                    PortfolioBacktestRequest runRequest = new PortfolioBacktestRequest(
                        request.getStartDate(), request.getEndDate(), request.getInitialInvestment(), frequency);

                    try {
                        PortfolioBacktestResponse response =
                            portfolioBacktestService.runBacktest(portfolioId, runRequest, jobId);
                        job.recordSuccess();
                        log.info("✓ 완료: {}/{} - portfolio={}, {}, totalReturn={}",
                            currentIndex, totalRuns, portfolioId, frequency,
                            response.getResult().getMetrics().getTotalReturn());
                    } catch (RuntimeException e) {
                        job.recordFailure();
                        log.error("✗ 실패: {}/{} - portfolio={}, {}, error={}",
                            currentIndex, totalRuns, portfolioId, frequency, e.getMessage());
                    }
                    jobRepository.save(job);
                }
            }

            log.info("=== 배치 백테스트 종료: jobId={}, 성공={}, 실패={} ===",
                jobId, job.getCompletedRuns(), job.getFailedRuns());

        } catch (RuntimeException e) {
            log.error("배치 백테스트 중단: jobId={}", jobId, e);
            job.fail(e.getMessage());
            jobRepository.save(job);
        }
    }
}
