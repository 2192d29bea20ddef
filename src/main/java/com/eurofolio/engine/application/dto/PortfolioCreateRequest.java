package com.eurofolio.engine.application.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
public class PortfolioCreateRequest {

    private String name;
    private String description;
    private String rebalanceFrequency = "ANNUALLY"; // NEVER, MONTHLY, QUARTERLY, ANNUALLY
    private Boolean isPublic = false;
    private List<AllocationRequest> allocations = new ArrayList<>();

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AllocationRequest {
        private Long assetId;
        private BigDecimal percentage; // 0 초과 100 이하
    }
}
