package com.eurofolio.engine.domain.repository;

import com.eurofolio.engine.domain.entity.Portfolio;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface PortfolioRepository extends JpaRepository<Portfolio, Long> {

    /**
     * 비중 및 자산까지 한 번에 로딩 (백테스트/조회용)
     */
    @Query("SELECT DISTINCT p FROM Portfolio p " +
           "LEFT JOIN FETCH p.allocations a " +
           "LEFT JOIN FETCH a.asset " +
           "WHERE p.id = :portfolioId")
    Optional<Portfolio> findWithAllocationsById(@Param("portfolioId") Long portfolioId);

    List<Portfolio> findAllByOrderByCreatedAtDesc();
}
