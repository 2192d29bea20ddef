package com.eurofolio.engine.application;

import com.eurofolio.engine.application.dto.AssetRegisterRequest;
import com.eurofolio.engine.application.dto.AssetResponse;
import com.eurofolio.engine.domain.entity.Asset;
import com.eurofolio.engine.domain.repository.AssetRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;

@Slf4j
@Service
@RequiredArgsConstructor
public class AssetService {

    private final AssetRepository assetRepository;

    @Transactional
    public AssetResponse register(AssetRegisterRequest request) {
        if (isBlank(request.getSymbol()) || isBlank(request.getExchange()) || isBlank(request.getName())) {
            throw new PortfolioValidationException("symbol, exchange and name are required");
        }

        String symbol = request.getSymbol().trim().toUpperCase(Locale.ROOT);
        String exchange = request.getExchange().trim().toUpperCase(Locale.ROOT);

        assetRepository.findBySymbolAndExchange(symbol, exchange).ifPresent(existing -> {
            throw new IllegalStateException("Asset already exists: " + existing.getTicker());
        });

        Asset asset = assetRepository.save(Asset.of(
            symbol,
            exchange,
            request.getName().trim(),
            request.getCurrency() != null ? request.getCurrency() : "EUR",
            request.getType() != null ? request.getType() : Asset.AssetType.ETF
        ));

        log.info("자산 등록: id={}, ticker={}", asset.getId(), asset.getTicker());
        return AssetResponse.from(asset);
    }

    @Transactional(readOnly = true)
    public AssetResponse getAsset(Long assetId) {
        return assetRepository.findById(assetId)
            .map(AssetResponse::from)
            .orElseThrow(() -> new IllegalArgumentException("Asset not found: " + assetId));
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
