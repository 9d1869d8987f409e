package com.simfolio.backend.service;

import com.simfolio.backend.model.SectorMapping;
import com.simfolio.backend.repository.SectorMappingRepository;
import com.simfolio.backend.service.marketdata.PriceOracle;
import com.simfolio.backend.service.marketdata.SectorCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Resolves a symbol's sector: operator override first, then the market-data provider, then
 * {@code "Unknown"}. Lookups are memoised in the injected {@link SectorCache}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SectorService {

    private final SectorMappingRepository repository;
    private final PriceOracle priceOracle;
    private final SectorCache sectorCache;

    public String getSector(String symbol) {
        return sectorCache.getOrLoad(symbol, this::lookup);
    }

    private String lookup(String symbol) {
        String sector = repository.findBySymbol(symbol)
                .map(SectorMapping::getSector)
                .orElseGet(() -> fromProvider(symbol));
        return sector == null || sector.isBlank() ? PriceOracle.UNKNOWN_SECTOR : sector;
    }

    private String fromProvider(String symbol) {
        try {
            return priceOracle.getSector(symbol);
        } catch (RuntimeException e) {
            log.warn("Sector provider failed for {}: {}", symbol, e.getMessage());
            return PriceOracle.UNKNOWN_SECTOR;
        }
    }
}
