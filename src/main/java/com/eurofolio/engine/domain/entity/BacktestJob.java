package com.eurofolio.engine.domain.entity;

import com.eurofolio.engine.domain.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 배치 백테스트 작업 (포트폴리오 × 리밸런싱 주기 조합 단위로 진행률 집계)
 */
@Entity
@Table(name = "backtest_jobs")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BacktestJob extends BaseTimeEntity {

    @Id
    @Column(name = "job_id", length = 64)
    private String jobId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private JobStatus status;

    @Column(nullable = false)
    private Integer totalRuns;

    @Column(nullable = false)
    private Integer completedRuns;

    @Column(nullable = false)
    private Integer failedRuns;

    @Column(length = 1000)
    private String errorMessage;

    private LocalDateTime startedAt;

    private LocalDateTime finishedAt;

    private BacktestJob(String jobId, Integer totalRuns) {
        this.jobId = jobId;
        this.status = JobStatus.PENDING;
        this.totalRuns = totalRuns;
        this.completedRuns = 0;
        this.failedRuns = 0;
    }

    public static BacktestJob create(String jobId, int totalRuns) {
        return new BacktestJob(jobId, totalRuns);
    }

    public void start() {
        this.status = JobStatus.RUNNING;
        this.startedAt = LocalDateTime.now();
    }

    public void recordSuccess() {
        this.completedRuns++;
        finishIfDone();
    }

    public void recordFailure() {
        this.failedRuns++;
        finishIfDone();
    }

    public void fail(String errorMessage) {
        this.status = JobStatus.FAILED;
        this.errorMessage = errorMessage;
        this.finishedAt = LocalDateTime.now();
    }

    public boolean isFinished() {
        return status == JobStatus.COMPLETED || status == JobStatus.FAILED;
    }

    /**
     * 처리된(성공 + 실패) 실행 비율 (0 ~ 100)
     */
    public int getProgress() {
        if (totalRuns == 0) {
            return 100;
        }
        return (int) (((completedRuns + failedRuns) * 100L) / totalRuns);
    }

    private void finishIfDone() {
        if (completedRuns + failedRuns >= totalRuns) {
            this.status = JobStatus.COMPLETED;
            this.finishedAt = LocalDateTime.now();
        }
    }

    public enum JobStatus {
        PENDING,    // 대기 중
        RUNNING,    // 실행 중
        COMPLETED,  // 완료 (개별 실패 포함 가능)
        FAILED      // 배치 자체 실패
    }
}
