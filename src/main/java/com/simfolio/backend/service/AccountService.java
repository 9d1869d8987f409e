package com.simfolio.backend.service;

import com.simfolio.backend.config.TradingProperties;
import com.simfolio.backend.exception.AccountAlreadyExistsException;
import com.simfolio.backend.exception.InvalidInputException;
import com.simfolio.backend.model.Account;
import com.simfolio.backend.model.LedgerTransaction;
import com.simfolio.backend.service.ledger.LedgerSnapshot;
import com.simfolio.backend.service.ledger.LedgerStore;
import com.simfolio.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class AccountService {

    private final LedgerStore ledgerStore;
    private final TradingProperties tradingProperties;

    /**
     * Onboarding: one account per user, cash starts equal to the starting balance.
     */
    public Account openAccount(Long userId, BigDecimal startingBalance) {
        if (userId == null) {
            throw new InvalidInputException("User id is required");
        }
        BigDecimal balance = startingBalance == null ? tradingProperties.getDefaultStartingBalance() : startingBalance;
        if (!MoneyUtils.isPositive(balance)) {
            throw new InvalidInputException("Starting balance must be greater than zero");
        }
        if (ledgerStore.readAccount(userId).isPresent()) {
            throw new AccountAlreadyExistsException("Account already exists for user " + userId);
        }
        try {
            Account account = ledgerStore.createAccount(Account.builder()
                    .userId(userId)
                    .startingBalance(MoneyUtils.scale(balance))
                    .cashBalance(MoneyUtils.scale(balance))
                    .build());
            log.info("Opened account user={} startingBalance={}", userId, account.getStartingBalance());
            return account;
        } catch (DataIntegrityViolationException e) {
            throw new AccountAlreadyExistsException("Account already exists for user " + userId);
        }
    }

    public Account getAccount(Long userId) {
        return ledgerStore.requireAccount(userId);
    }

    public List<LedgerTransaction> getTransactions(Long userId) {
        ledgerStore.requireAccount(userId);
        return ledgerStore.readTransactions(userId);
    }

    /**
     * Recomputes the balance the log implies ({@code startingBalance} plus the signed cash
     * effect of every transaction) and compares it with the stored balance.
     */
    public Reconciliation reconcile(Long userId) {
        LedgerSnapshot snapshot = ledgerStore.readLedger(userId);
        Account account = snapshot.account();
        BigDecimal expected = MoneyUtils.scale(account.getStartingBalance());
        for (LedgerTransaction txn : snapshot.transactions()) {
            if (txn.getType() == null || txn.getTotalAmount() == null) {
                continue;
            }
            BigDecimal amount = txn.getTotalAmount();
            expected = txn.getType().cashSign() > 0 ? MoneyUtils.add(expected, amount) : MoneyUtils.subtract(expected, amount);
        }
        BigDecimal actual = MoneyUtils.scale(account.getCashBalance());
        boolean consistent = expected.compareTo(actual) == 0;
        if (!consistent) {
            log.error("Ledger mismatch user={} expected={} actual={}", userId, expected, actual);
        }
        return new Reconciliation(userId, expected, actual, snapshot.transactions().size(), consistent);
    }

    public record Reconciliation(
            Long userId,
            BigDecimal expectedBalance,
            BigDecimal actualBalance,
            int transactionCount,
            boolean consistent
    ) {}
}
