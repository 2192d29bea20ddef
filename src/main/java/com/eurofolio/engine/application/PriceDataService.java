package com.eurofolio.engine.application;

import com.eurofolio.engine.adapter.out.api.ApiQuotaExceededException;
import com.eurofolio.engine.adapter.out.api.EodhdApiClient;
import com.eurofolio.engine.application.backtest.engine.dto.PricePoint;
import com.eurofolio.engine.application.dto.AssetPriceResponse;
import com.eurofolio.engine.domain.entity.Asset;
import com.eurofolio.engine.domain.entity.PriceData;
import com.eurofolio.engine.domain.repository.AssetRepository;
import com.eurofolio.engine.domain.repository.PriceDataRepository;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.codec.CodecException;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.reactive.function.client.WebClientException;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 자산별 일봉 시세 관리
 * - DB 캐시 우선 조회, 없으면 EODHD에서 받아 저장
 * - 클래스패스 CSV 적재
 */
@Slf4j
@Service
public class PriceDataService {

    private final PriceDataRepository priceDataRepository;
    private final AssetRepository assetRepository;
    private final EodhdApiClient eodhdApiClient;
    private final boolean externalFetchEnabled;

    public PriceDataService(PriceDataRepository priceDataRepository,
                            AssetRepository assetRepository,
                            EodhdApiClient eodhdApiClient,
                            @Value("${eodhd.api.enabled:false}") boolean externalFetchEnabled) {
        this.priceDataRepository = priceDataRepository;
        this.assetRepository = assetRepository;
        this.eodhdApiClient = eodhdApiClient;
        this.externalFetchEnabled = externalFetchEnabled;
    }

    /**
     * 기간 내 종가 시계열
     * 캐시가 기간을 다 덮지 못하고 외부 조회가 켜져 있으면 EODHD에서 빠진 날짜를 받아 저장한다.
     * 한도 초과나 API 오류 시에는 캐시된 부분만 반환한다.
     */
    @Transactional
    public List<PricePoint> getPriceSeries(Asset asset, LocalDate startDate, LocalDate endDate) {
        return loadPrices(asset, startDate, endDate).rows.stream()
            .map(price -> new PricePoint(price.getTradeDate(), price.getClosePrice()))
            .collect(Collectors.toList());
    }

    /**
     * 자산 시세 조회 (캐시 우선, 부족하면 백필)
     */
    @Transactional
    public AssetPriceResponse getAssetPrices(Long assetId, LocalDate startDate, LocalDate endDate) {
        Asset asset = assetRepository.findById(assetId)
            .orElseThrow(() -> new IllegalArgumentException("Asset not found: " + assetId));
        LoadedPrices loaded = loadPrices(asset, startDate, endDate);
        return AssetPriceResponse.of(asset, loaded.rows, loaded.cachedCount, loaded.fetchedCount,
            loaded.incomplete ? "Some data may be incomplete due to API limitations" : null);
    }

    private LoadedPrices loadPrices(Asset asset, LocalDate startDate, LocalDate endDate) {
        List<PriceData> cached = priceDataRepository.findByAssetAndPeriod(asset.getId(), startDate, endDate);

        if (!externalFetchEnabled || coversRange(cached, startDate, endDate)) {
            return new LoadedPrices(cached, cached.size(), 0, false);
        }

        log.info("캐시 시세 부족 ({}건), 외부 조회: {} ({} ~ {})", cached.size(), asset.getTicker(), startDate, endDate);
        try {
            int fetched = fetchAndStore(asset, startDate, endDate);
            List<PriceData> rows = fetched > 0
                ? priceDataRepository.findByAssetAndPeriod(asset.getId(), startDate, endDate)
                : cached;
            return new LoadedPrices(rows, cached.size(), fetched, false);
        } catch (ApiQuotaExceededException e) {
            log.warn("시세 백필 건너뜀 (호출 한도 초과): {}", asset.getTicker());
        } catch (WebClientException | CodecException e) {
            log.error("시세 백필 실패: {}", asset.getTicker(), e);
        }
        return new LoadedPrices(cached, cached.size(), 0, true);
    }

    /**
     * 첫 거래일이 시작일 이후이거나 마지막 거래일이 종료일 이전이면 부족한 것으로 본다
     */
    private boolean coversRange(List<PriceData> cached, LocalDate startDate, LocalDate endDate) {
        if (cached.isEmpty()) {
            return false;
        }
        LocalDate first = cached.get(0).getTradeDate();
        LocalDate last = cached.get(cached.size() - 1).getTradeDate();
        return !first.isAfter(startDate) && !last.isBefore(endDate);
    }

    /**
     * EODHD 일봉을 받아 저장 (이미 있는 날짜는 건너뜀)
     * @return 새로 저장한 건수
     */
    @Transactional
    public int fetchAndStore(Long assetId, LocalDate startDate, LocalDate endDate) {
        Asset asset = assetRepository.findById(assetId)
            .orElseThrow(() -> new IllegalArgumentException("Asset not found: " + assetId));
        return fetchAndStore(asset, startDate, endDate);
    }

    /**
     * 클래스패스 CSV 적재
     * 형식: date,open,high,low,close,adjusted_close,volume (헤더 1행)
     * @return 새로 저장한 건수
     */
    @Transactional
    public int importFromCsv(Long assetId, String resourcePath) {
        Asset asset = assetRepository.findById(assetId)
            .orElseThrow(() -> new IllegalArgumentException("Asset not found: " + assetId));

        log.info("CSV 시세 적재 시작: asset={}, file={}", asset.getTicker(), resourcePath);

        ClassPathResource resource = new ClassPathResource(resourcePath);
        if (!resource.exists()) {
            throw new IllegalArgumentException("CSV resource not found: " + resourcePath);
        }

        Set<LocalDate> existingDates = new HashSet<>(priceDataRepository.findTradeDatesByAssetId(assetId));
        List<PriceData> rows = new ArrayList<>();
        int skipped = 0;

        try (CSVReader reader = new CSVReader(
            new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {

            String[] nextLine;
            reader.readNext(); // 헤더 건너뛰기

            while ((nextLine = reader.readNext()) != null) {
                try {
                    LocalDate date = LocalDate.parse(nextLine[0].trim(), DateTimeFormatter.ISO_LOCAL_DATE);
                    if (!existingDates.add(date)) {
                        continue;
                    }
                    rows.add(PriceData.of(
                        asset,
                        date,
                        decimalOrNull(nextLine[1]),
                        decimalOrNull(nextLine[2]),
                        decimalOrNull(nextLine[3]),
                        new BigDecimal(nextLine[4].trim()),
                        decimalOrNull(nextLine[5]),
                        nextLine[6].isBlank() ? null : Long.parseLong(nextLine[6].trim())
                    ));
                } catch (RuntimeException e) {
                    skipped++;
                    log.warn("CSV 행 파싱 실패 (건너뜀): {}", String.join(",", nextLine), e);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read CSV: " + resourcePath, e);
        } catch (CsvValidationException e) {
            throw new IllegalArgumentException("Malformed CSV: " + resourcePath, e);
        }

        priceDataRepository.saveAll(rows);
        log.info("CSV 시세 적재 완료: asset={}, 저장 {}건, 건너뜀 {}건", asset.getTicker(), rows.size(), skipped);
        return rows.size();
    }

    private int fetchAndStore(Asset asset, LocalDate startDate, LocalDate endDate) {
        List<EodhdApiClient.EodhdDailyPriceDto> prices =
            eodhdApiClient.fetchDailyPrices(asset.getTicker(), startDate, endDate);

        Set<LocalDate> existingDates = new HashSet<>(priceDataRepository.findTradeDatesByAssetId(asset.getId()));
        List<PriceData> rows = new ArrayList<>();
        for (EodhdApiClient.EodhdDailyPriceDto dto : prices) {
            if (dto.getDate() == null || dto.getClose() == null) {
                log.warn("불완전한 시세 건너뜀: {} {}", asset.getTicker(), dto);
                continue;
            }
            LocalDate date;
            try {
                date = LocalDate.parse(dto.getDate(), DateTimeFormatter.ISO_LOCAL_DATE);
            } catch (DateTimeParseException e) {
                log.warn("시세 날짜 파싱 실패 (건너뜀): {} {}", asset.getTicker(), dto.getDate());
                continue;
            }
            if (existingDates.add(date)) {
                rows.add(mapDtoToEntity(asset, date, dto));
            }
        }

        priceDataRepository.saveAll(rows);
        log.info("EODHD 시세 저장: {} {}건 (수신 {}건)", asset.getTicker(), rows.size(), prices.size());
        return rows.size();
    }

    private PriceData mapDtoToEntity(Asset asset, LocalDate date, EodhdApiClient.EodhdDailyPriceDto dto) {
        return PriceData.of(
            asset,
            date,
            dto.getOpen(),
            dto.getHigh(),
            dto.getLow(),
            dto.getClose(),
            dto.getAdjustedClose(),
            dto.getVolume()
        );
    }

    private BigDecimal decimalOrNull(String raw) {
        return raw == null || raw.isBlank() ? null : new BigDecimal(raw.trim());
    }

    private static final class LoadedPrices {
        private final List<PriceData> rows;
        private final int cachedCount;
        private final int fetchedCount;
        private final boolean incomplete; // 백필 실패

        private LoadedPrices(List<PriceData> rows, int cachedCount, int fetchedCount, boolean incomplete) {
            this.rows = rows;
            this.cachedCount = cachedCount;
            this.fetchedCount = fetchedCount;
            this.incomplete = incomplete;
        }
    }
}
