package com.simfolio.backend.service.ledger;

import java.math.BigDecimal;
import java.time.Instant;

/** Equity relative to the starting balance at one point of the curve. */
public record PnlPoint(Instant timestamp, BigDecimal pnl) {}
