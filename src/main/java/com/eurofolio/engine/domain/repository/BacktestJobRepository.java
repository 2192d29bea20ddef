package com.eurofolio.engine.domain.repository;

import com.eurofolio.engine.domain.entity.BacktestJob;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BacktestJobRepository extends JpaRepository<BacktestJob, String> {
}
