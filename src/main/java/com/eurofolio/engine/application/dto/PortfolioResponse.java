package com.eurofolio.engine.application.dto;

import com.eurofolio.engine.domain.entity.Portfolio;
import com.eurofolio.engine.domain.entity.PortfolioAllocation;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

@Getter
@AllArgsConstructor
public class PortfolioResponse {

    private final Long id;
    private final String name;
    private final String description;
    private final String rebalanceFrequency;
    private final Boolean isPublic;
    private final LocalDateTime createdAt;
    private final List<AllocationResponse> allocations;

    /**
     * 비중/자산이 로딩된 상태(트랜잭션 안)에서 호출해야 한다
     */
    public static PortfolioResponse from(Portfolio portfolio) {
        return new PortfolioResponse(
            portfolio.getId(),
            portfolio.getName(),
            portfolio.getDescription(),
            portfolio.getRebalanceFrequency(),
            portfolio.getIsPublic(),
            portfolio.getCreatedAt(),
            portfolio.getAllocations().stream()
                .map(AllocationResponse::from)
                .collect(Collectors.toList())
        );
    }

    @Getter
    @AllArgsConstructor
    public static class AllocationResponse {
        private final Long assetId;
        private final String ticker;
        private final String assetName;
        private final BigDecimal percentage;

        static AllocationResponse from(PortfolioAllocation allocation) {
            return new AllocationResponse(
                allocation.getAsset().getId(),
                allocation.getAsset().getTicker(),
                allocation.getAsset().getName(),
                allocation.getPercentage()
            );
        }
    }
}
