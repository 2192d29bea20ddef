package com.eurofolio.engine.application;

import com.eurofolio.engine.application.backtest.engine.dto.RebalanceFrequency;
import com.eurofolio.engine.application.dto.PortfolioCreateRequest;
import com.eurofolio.engine.application.dto.PortfolioResponse;
import com.eurofolio.engine.domain.entity.Asset;
import com.eurofolio.engine.domain.entity.Portfolio;
import com.eurofolio.engine.domain.repository.AssetRepository;
import com.eurofolio.engine.domain.repository.PortfolioRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class PortfolioService {

    private static final BigDecimal FULL_ALLOCATION = new BigDecimal("100");
    private static final BigDecimal ALLOCATION_TOLERANCE = new BigDecimal("0.01");

    private final PortfolioRepository portfolioRepository;
    private final AssetRepository assetRepository;

    /**
     * 포트폴리오 생성
     * 비중 합계는 100% (허용 오차 0.01%p)
     */
    @Transactional
    public PortfolioResponse createPortfolio(PortfolioCreateRequest request) {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new PortfolioValidationException("Name is required");
        }
        List<PortfolioCreateRequest.AllocationRequest> allocations = request.getAllocations();
        if (allocations == null || allocations.isEmpty()) {
            throw new PortfolioValidationException("At least one allocation is required");
        }

        RebalanceFrequency frequency = parseFrequency(request.getRebalanceFrequency());
        validateAllocations(allocations);

        Portfolio portfolio = Portfolio.create(
            request.getName().trim(), request.getDescription(), frequency.name(), request.getIsPublic());

        for (PortfolioCreateRequest.AllocationRequest allocation : allocations) {
            Asset asset = assetRepository.findById(allocation.getAssetId())
                .orElseThrow(() -> new IllegalArgumentException("Asset not found: " + allocation.getAssetId()));
            portfolio.addAllocation(asset, allocation.getPercentage());
        }

        Portfolio saved = portfolioRepository.save(portfolio);
        log.info("포트폴리오 생성: id={}, name={}, 자산 {}개, 리밸런싱={}",
            saved.getId(), saved.getName(), allocations.size(), frequency);
        return PortfolioResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public PortfolioResponse getPortfolio(Long portfolioId) {
        return portfolioRepository.findWithAllocationsById(portfolioId)
            .map(PortfolioResponse::from)
            .orElseThrow(() -> new IllegalArgumentException("Portfolio not found: " + portfolioId));
    }

    @Transactional(readOnly = true)
    public List<PortfolioResponse> getPortfolios() {
        return portfolioRepository.findAllByOrderByCreatedAtDesc().stream()
            .map(PortfolioResponse::from)
            .collect(Collectors.toList());
    }

    private void validateAllocations(List<PortfolioCreateRequest.AllocationRequest> allocations) {
        Set<Long> assetIds = new HashSet<>();
        BigDecimal total = BigDecimal.ZERO;

        for (PortfolioCreateRequest.AllocationRequest allocation : allocations) {
            if (allocation.getAssetId() == null) {
                throw new PortfolioValidationException("Allocation assetId is required");
            }
            if (!assetIds.add(allocation.getAssetId())) {
                throw new PortfolioValidationException("Duplicate asset in allocations: " + allocation.getAssetId());
            }
            BigDecimal percentage = allocation.getPercentage();
            if (percentage == null || percentage.signum() <= 0 || percentage.compareTo(FULL_ALLOCATION) > 0) {
                throw new PortfolioValidationException(
                    "Allocation percentage must be in (0, 100]: asset " + allocation.getAssetId());
            }
            total = total.add(percentage);
        }

        if (total.subtract(FULL_ALLOCATION).abs().compareTo(ALLOCATION_TOLERANCE) > 0) {
            throw new PortfolioValidationException(
                "Allocation percentages must sum to 100%. Current total: " + total.toPlainString() + "%");
        }
    }

    private RebalanceFrequency parseFrequency(String value) {
        if (value == null || value.isBlank()) {
            return RebalanceFrequency.ANNUALLY;
        }
        try {
            return RebalanceFrequency.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new PortfolioValidationException("Unknown rebalance frequency: " + value);
        }
    }
}
