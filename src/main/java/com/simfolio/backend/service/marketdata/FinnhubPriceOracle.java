package com.simfolio.backend.service.marketdata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.simfolio.backend.exception.MarketDataDegradedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * {@link PriceOracle} over Finnhub's {@code /quote} (field {@code c}) and {@code /stock/profile2}
 * (field {@code finnhubIndustry}) endpoints.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FinnhubPriceOracle implements PriceOracle {

    private static final String QUOTE_PATH = "/quote";
    private static final String PROFILE_PATH = "/stock/profile2";

    private final FinnhubHttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Override
    public Optional<BigDecimal> getPrice(String symbol) {
        if (!httpClient.isConfigured()) {
            log.warn("Finnhub API key not configured, no price for {}", symbol);
            return Optional.empty();
        }
        try {
            JsonNode root = parse(httpClient.get(QUOTE_PATH, symbol));
            JsonNode current = root.path("c");
            if (!current.isNumber()) {
                log.warn("Finnhub quote for {} has no current price", symbol);
                return Optional.empty();
            }
            BigDecimal price = current.decimalValue();
            if (price.signum() <= 0) {
                log.warn("Finnhub returned non-positive price {} for {}", price, symbol);
                return Optional.empty();
            }
            return Optional.of(price);
        } catch (MarketDataDegradedException e) {
            log.warn("Price lookup failed for {}: {}", symbol, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public String getSector(String symbol) {
        if (!httpClient.isConfigured()) {
            return UNKNOWN_SECTOR;
        }
        try {
            JsonNode root = parse(httpClient.get(PROFILE_PATH, symbol));
            String industry = root.path("finnhubIndustry").asText("");
            return industry.isBlank() ? UNKNOWN_SECTOR : industry;
        } catch (MarketDataDegradedException e) {
            log.warn("Sector lookup failed for {}: {}", symbol, e.getMessage());
            return UNKNOWN_SECTOR;
        }
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            throw new MarketDataDegradedException("Empty Finnhub response");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MarketDataDegradedException("Unparseable Finnhub response", e);
        }
    }
}
