package com.simfolio.backend.service.analytics;

import com.simfolio.backend.config.AnalyticsProperties;
import com.simfolio.backend.service.ledger.EquityPoint;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Return statistics over an equity curve. All figures are annualised with the configured
 * number of trading days and kept at full double precision.
 */
@Component
@RequiredArgsConstructor
public class ReturnStatisticsCalculator {

    private final AnalyticsProperties properties;

    /**
     * One equity value per UTC calendar day (the day's last point), then simple
     * day-over-day returns. A day following a zero equity is skipped.
     */
    public List<Double> dailyReturns(List<EquityPoint> points) {
        if (points == null || points.size() < 2) {
            return List.of();
        }
        Map<LocalDate, Double> byDay = new TreeMap<>();
        for (EquityPoint point : points) {
            if (point.timestamp() == null || point.equity() == null) {
                continue;
            }
            byDay.put(LocalDate.ofInstant(point.timestamp(), ZoneOffset.UTC), point.equity().doubleValue());
        }
        List<Double> equities = new ArrayList<>(byDay.values());
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < equities.size(); i++) {
            double previous = equities.get(i - 1);
            if (previous == 0.0) {
                continue;
            }
            returns.add((equities.get(i) - previous) / previous);
        }
        return returns;
    }

    /**
     * Sample standard deviation (n - 1) of daily returns times the square root of the trading
     * days per year; 0 with fewer than two returns.
     */
    public double volatility(List<Double> dailyReturns) {
        if (dailyReturns == null || dailyReturns.size() < 2) {
            return 0.0;
        }
        int n = dailyReturns.size();
        double mean = dailyReturns.stream().mapToDouble(Double::doubleValue).sum() / n;
        double sumSquares = dailyReturns.stream()
                .mapToDouble(r -> (r - mean) * (r - mean))
                .sum();
        double dailyStdDev = Math.sqrt(sumSquares / (n - 1));
        return dailyStdDev * Math.sqrt(properties.getTradingDaysPerYear());
    }

    /**
     * First-to-last return of the curve; 0 when the first equity is not positive.
     */
    public double totalReturn(List<EquityPoint> points) {
        if (points == null || points.isEmpty()) {
            return 0.0;
        }
        double first = points.get(0).equity().doubleValue();
        double last = points.get(points.size() - 1).equity().doubleValue();
        return first > 0 ? (last - first) / first : 0.0;
    }

    public double annualizedReturn(double totalReturn, int returnDays) {
        if (returnDays <= 0) {
            return 0.0;
        }
        return Math.pow(1 + totalReturn, (double) properties.getTradingDaysPerYear() / returnDays) - 1;
    }

    public double sharpeRatio(double annualizedReturn, double annualizedVolatility) {
        if (annualizedVolatility == 0.0) {
            return 0.0;
        }
        return (annualizedReturn - properties.getRiskFreeRate()) / annualizedVolatility;
    }
}
