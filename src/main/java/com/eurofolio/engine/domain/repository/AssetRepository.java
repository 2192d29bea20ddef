package com.eurofolio.engine.domain.repository;

import com.eurofolio.engine.domain.entity.Asset;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface AssetRepository extends JpaRepository<Asset, Long> {

    Optional<Asset> findBySymbolAndExchange(String symbol, String exchange);
}
