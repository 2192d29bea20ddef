package com.eurofolio.engine.adapter.in.web;

import com.eurofolio.engine.application.backtest.AsyncBacktestService;
import com.eurofolio.engine.application.backtest.dto.BatchBacktestRequest;
import com.eurofolio.engine.application.backtest.engine.BacktestValidationException;
import com.eurofolio.engine.domain.entity.BacktestJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/backtest")
@RequiredArgsConstructor
@Slf4j
public class BacktestController {

    private final AsyncBacktestService asyncBacktestService;

    /**
     * 배치 백테스트 등록 (포트폴리오 × 리밸런싱 주기)
     * @return jobId, 진행 상황은 /jobs/{jobId}로 조회
     */
    @PostMapping("/batch")
    public ResponseEntity<?> submitBatch(@RequestBody BatchBacktestRequest request) {
        log.info("[API] 배치 백테스트 요청: portfolios={}, frequencies={}, {} ~ {}",
            request.getPortfolioIds(), request.getRebalanceFrequencies(), request.getStartDate(), request.getEndDate());
        try {
            String jobId = asyncBacktestService.submitBatchBacktest(request);
            return ResponseEntity.accepted().body(new AsyncJobResponse(jobId, "배치 백테스트 작업이 등록되었습니다."));
        } catch (BacktestValidationException e) {
            return ApiResponses.error(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (Exception e) {
            log.error("[API] 배치 백테스트 등록 실패", e);
            return ApiResponses.error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to submit batch job: " + e.getMessage());
        }
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<?> getJobStatus(@PathVariable String jobId) {
        try {
            BacktestJob job = asyncBacktestService.getJobStatus(jobId);
            return ResponseEntity.ok(new JobStatusResponse(
                job.getJobId(),
                job.getStatus().name(),
                job.getTotalRuns(),
                job.getCompletedRuns(),
                job.getFailedRuns(),
                job.getProgress(),
                job.isFinished(),
                job.getErrorMessage()
            ));
        } catch (IllegalArgumentException e) {
            return ApiResponses.error(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }

    @GetMapping("/jobs/{jobId}/results")
    public ResponseEntity<?> getJobResults(@PathVariable String jobId) {
        try {
            return ResponseEntity.ok(asyncBacktestService.getJobResults(jobId));
        } catch (IllegalArgumentException e) {
            return ApiResponses.error(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (IllegalStateException e) {
            return ApiResponses.error(HttpStatus.CONFLICT, e.getMessage());
        }
    }

    record AsyncJobResponse(String jobId, String message) {}

    record JobStatusResponse(
        String jobId,
        String status,
        int totalRuns,
        int completedRuns,
        int failedRuns,
        int progress,
        boolean finished,
        String errorMessage
    ) {}
}
