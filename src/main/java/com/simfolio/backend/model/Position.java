package com.simfolio.backend.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Open holding valued at a live price. Derived on every read, never stored; percentages are
 * kept at full precision here and rounded when rendered.
 */
@Value
@Builder(toBuilder = true)
public class Position {
    String symbol;
    long netQuantity;
    BigDecimal avgCost;
    BigDecimal currentPrice;
    BigDecimal marketValue;
    BigDecimal unrealizedPnL;
    BigDecimal gainPercent;
    BigDecimal allocationPercent;
}
