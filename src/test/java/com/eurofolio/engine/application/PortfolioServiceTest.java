package com.eurofolio.engine.application;

import com.eurofolio.engine.application.dto.PortfolioCreateRequest;
import com.eurofolio.engine.application.dto.PortfolioResponse;
import com.eurofolio.engine.domain.entity.Asset;
import com.eurofolio.engine.domain.entity.Portfolio;
import com.eurofolio.engine.domain.repository.AssetRepository;
import com.eurofolio.engine.domain.repository.PortfolioRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PortfolioServiceTest {

    @Mock
    private PortfolioRepository portfolioRepository;

    @Mock
    private AssetRepository assetRepository;

    @InjectMocks
    private PortfolioService portfolioService;

    @Test
    void createsPortfolioWithinTolerance() {
        // Given: 60 + 40.005 = 100.005 (허용 오차 이내), 주기 소문자
        Asset equity = asset(1L, "VWCE");
        Asset bond = asset(2L, "AGGH");
        when(assetRepository.findById(1L)).thenReturn(Optional.of(equity));
        when(assetRepository.findById(2L)).thenReturn(Optional.of(bond));
        when(portfolioRepository.save(any(Portfolio.class))).thenAnswer(invocation -> invocation.getArgument(0));

        PortfolioCreateRequest request = request("Core", "quarterly",
            allocation(1L, "60"), allocation(2L, "40.005"));

        // When
        PortfolioResponse response = portfolioService.createPortfolio(request);

        // Then
        assertThat(response.getRebalanceFrequency()).isEqualTo("QUARTERLY");
        assertThat(response.getAllocations()).extracting(PortfolioResponse.AllocationResponse::getTicker)
            .containsExactly("VWCE.XETRA", "AGGH.XETRA");
    }

    @Test
    void rejectsInvalidAllocations() {
        assertRejected(request("Off", null, allocation(1L, "99")), "sum to 100%");
        assertRejected(request("Off", null, allocation(1L, "60"), allocation(2L, "40.02")), "sum to 100%");
        assertRejected(request("Dup", null, allocation(1L, "50"), allocation(1L, "50")), "Duplicate asset");
        assertRejected(request("Zero", null, allocation(1L, "0"), allocation(2L, "100")), "(0, 100]");
        assertRejected(request(" ", null, allocation(1L, "100")), "Name is required");
        assertRejected(request("Freq", "WEEKLY", allocation(1L, "100")), "Unknown rebalance frequency");
        assertRejected(request("None", null), "At least one allocation");
        verify(portfolioRepository, never()).save(any());
    }

    @Test
    void unknownAssetIsNotFound() {
        when(assetRepository.findById(7L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> portfolioService.createPortfolio(request("Ghost", null, allocation(7L, "100"))))
            .isInstanceOf(IllegalArgumentException.class)
            .isNotInstanceOf(PortfolioValidationException.class)
            .hasMessageContaining("Asset not found");
    }

    private void assertRejected(PortfolioCreateRequest request, String message) {
        assertThatThrownBy(() -> portfolioService.createPortfolio(request))
            .isInstanceOf(PortfolioValidationException.class)
            .hasMessageContaining(message);
    }

    private PortfolioCreateRequest request(String name, String frequency,
                                           PortfolioCreateRequest.AllocationRequest... allocations) {
        PortfolioCreateRequest request = new PortfolioCreateRequest();
        request.setName(name);
        request.setRebalanceFrequency(frequency);
        request.setAllocations(List.of(allocations));
        return request;
    }

    private PortfolioCreateRequest.AllocationRequest allocation(Long assetId, String percentage) {
        return new PortfolioCreateRequest.AllocationRequest(assetId, new BigDecimal(percentage));
    }

    private Asset asset(Long id, String symbol) {
        Asset asset = Asset.of(symbol, "XETRA", symbol + " ETF", "EUR", Asset.AssetType.ETF);
        ReflectionTestUtils.setField(asset, "id", id);
        return asset;
    }
}
