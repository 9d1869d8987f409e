package com.simfolio.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    public void recordTradeExecuted(String type) {
        Counter.builder("trades_executed_total")
                .tag("type", type == null ? "unknown" : type)
                .register(meterRegistry)
                .increment();
    }

    public void recordTradeRejected(String reason) {
        Counter.builder("trades_rejected_total")
                .tag("reason", reason == null ? "unknown" : reason)
                .register(meterRegistry)
                .increment();
    }

    public void recordMarketDataFailure(String reason) {
        Counter.builder("market_data_failures_total")
                .tag("reason", reason == null ? "unknown" : reason)
                .register(meterRegistry)
                .increment();
    }
}
