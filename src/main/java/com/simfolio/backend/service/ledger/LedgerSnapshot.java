package com.simfolio.backend.service.ledger;

import com.simfolio.backend.model.Account;
import com.simfolio.backend.model.LedgerTransaction;

import java.util.List;

/** Account and log read together, so the balance matches the transactions it came from. */
public record LedgerSnapshot(Account account, List<LedgerTransaction> transactions) {}
