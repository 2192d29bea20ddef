package com.eurofolio.engine.application.backtest;

import com.eurofolio.engine.application.backtest.dto.BacktestRecordResponse;
import com.eurofolio.engine.application.backtest.dto.BatchBacktestRequest;
import com.eurofolio.engine.application.backtest.engine.BacktestValidationException;
import com.eurofolio.engine.application.backtest.engine.dto.RebalanceFrequency;
import com.eurofolio.engine.domain.entity.BacktestJob;
import com.eurofolio.engine.domain.repository.BacktestJobRepository;
import com.eurofolio.engine.domain.repository.BacktestRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 비동기 배치 백테스트
 * - 작업 등록 후 즉시 jobId 반환, 실행은 {@link BatchBacktestRunner}
 * - 진행 상황은 backtest_jobs, 실행별 결과는 backtest_results(job_id)에 저장
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AsyncBacktestService {

    private final BatchBacktestRunner batchRunner;
    private final BacktestJobRepository jobRepository;
    private final BacktestRecordRepository recordRepository;

    /**
     * @return jobId (작업 추적용)
     */
    public String submitBatchBacktest(BatchBacktestRequest request) {
        if (request.getPortfolioIds() == null || request.getPortfolioIds().isEmpty()) {
            throw new BacktestValidationException("portfolioIds is required");
        }
        if (request.getStartDate() == null || request.getEndDate() == null) {
            throw new BacktestValidationException("startDate and endDate are required");
        }
        if (!request.getStartDate().isBefore(request.getEndDate())) {
            throw new BacktestValidationException("Start date must be before end date");
        }
        if (request.getRebalanceFrequencies() == null || request.getRebalanceFrequencies().isEmpty()) {
            request.setRebalanceFrequencies(List.of(RebalanceFrequency.ANNUALLY));
        }

        String jobId = UUID.randomUUID().toString();
        int totalRuns = request.getPortfolioIds().size() * request.getRebalanceFrequencies().size();
        jobRepository.save(BacktestJob.create(jobId, totalRuns));

        log.info("배치 백테스트 작업 등록: jobId={}, 포트폴리오 {}개 × 주기 {}개 = {}건",
            jobId, request.getPortfolioIds().size(), request.getRebalanceFrequencies().size(), totalRuns);

        batchRunner.runAsync(jobId, request);
        return jobId;
    }

    @Transactional(readOnly = true)
    public BacktestJob getJobStatus(String jobId) {
        return jobRepository.findById(jobId)
            .orElseThrow(() -> new IllegalArgumentException("Job not found: " + jobId));
    }

    /**
     * 완료된 작업의 실행별 결과 (실패한 실행은 포함되지 않음)
     */
    @Transactional(readOnly = true)
    public List<BacktestRecordResponse> getJobResults(String jobId) {
        BacktestJob job = getJobStatus(jobId);
        if (job.getStatus() != BacktestJob.JobStatus.COMPLETED) {
            throw new IllegalStateException("Job not completed yet: " + jobId + " (" + job.getStatus() + ")");
        }
        return recordRepository.findByJobIdOrderByIdAsc(jobId).stream()
            .map(BacktestRecordResponse::from)
            .collect(Collectors.toList());
    }
}
