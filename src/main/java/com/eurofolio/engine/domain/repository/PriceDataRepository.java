package com.eurofolio.engine.domain.repository;

import com.eurofolio.engine.domain.entity.PriceData;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;

public interface PriceDataRepository extends JpaRepository<PriceData, Long> {

    /**
     * 기간 내 일봉 시세 (날짜 오름차순)
     */
    @Query("SELECT p FROM PriceData p " +
           "WHERE p.asset.id = :assetId " +
           "AND p.tradeDate BETWEEN :startDate AND :endDate " +
           "ORDER BY p.tradeDate ASC")
    List<PriceData> findByAssetAndPeriod(
        @Param("assetId") Long assetId,
        @Param("startDate") LocalDate startDate,
        @Param("endDate") LocalDate endDate
    );

    /**
     * 이미 저장된 거래일 (중복 저장 방지)
     */
    @Query("SELECT p.tradeDate FROM PriceData p WHERE p.asset.id = :assetId")
    List<LocalDate> findTradeDatesByAssetId(@Param("assetId") Long assetId);
}
