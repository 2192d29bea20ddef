package com.eurofolio.engine.domain.repository;

import com.eurofolio.engine.domain.entity.BacktestRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface BacktestRecordRepository extends JpaRepository<BacktestRecord, Long> {

    /**
     * 포트폴리오별 최근 백테스트 10건
     */
    List<BacktestRecord> findTop10ByPortfolioIdOrderByCreatedAtDesc(Long portfolioId);

    List<BacktestRecord> findByJobIdOrderByIdAsc(String jobId);
}
