package com.simfolio.backend.service;

import com.simfolio.backend.config.TradingProperties;
import com.simfolio.backend.exception.InsufficientBalanceException;
import com.simfolio.backend.exception.InsufficientHoldingsException;
import com.simfolio.backend.exception.InvalidInputException;
import com.simfolio.backend.exception.PriceUnavailableException;
import com.simfolio.backend.exception.StoreFailureException;
import com.simfolio.backend.exception.TradingException;
import com.simfolio.backend.model.Account;
import com.simfolio.backend.model.LedgerTransaction;
import com.simfolio.backend.model.TransactionType;
import com.simfolio.backend.service.ledger.AccountLockRegistry;
import com.simfolio.backend.service.ledger.LedgerStore;
import com.simfolio.backend.service.ledger.PositionReplayer;
import com.simfolio.backend.service.marketdata.PriceOracle;
import com.simfolio.backend.util.MoneyUtils;
import jakarta.persistence.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Executes one market BUY or SELL against a user's simulated account.
 *
 * <p>The price is fetched first, outside any lock. The balance check, the balance update and
 * the log append then run under the account's lock inside one store transaction: either both
 * writes commit or neither is visible. Failures are reported once and never retried here.
 */
@Slf4j
@Service
public class TradeExecutionService {

    private final LedgerStore ledgerStore;
    private final PositionReplayer positionReplayer;
    private final PriceOracle priceOracle;
    private final AccountLockRegistry lockRegistry;
    private final MetricsService metricsService;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final int commitTimeoutSeconds;

    public TradeExecutionService(LedgerStore ledgerStore,
                                 PositionReplayer positionReplayer,
                                 PriceOracle priceOracle,
                                 AccountLockRegistry lockRegistry,
                                 MetricsService metricsService,
                                 PlatformTransactionManager transactionManager,
                                 TradingProperties tradingProperties,
                                 Clock clock) {
        this.ledgerStore = ledgerStore;
        this.positionReplayer = positionReplayer;
        this.priceOracle = priceOracle;
        this.lockRegistry = lockRegistry;
        this.metricsService = metricsService;
        this.clock = clock;
        this.commitTimeoutSeconds = tradingProperties.getCommitTimeoutSeconds();
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout(commitTimeoutSeconds);
    }

    public TradeResult executeTrade(Long userId, String symbol, TransactionType type, Integer quantity) {
        try {
            String normalizedSymbol = validate(userId, symbol, type, quantity);
            BigDecimal price = fetchPrice(normalizedSymbol);
            BigDecimal totalAmount = MoneyUtils.multiply(price, quantity);
            TradeResult result = commitUnderAccountLock(userId, normalizedSymbol, type, quantity, price, totalAmount);
            metricsService.recordTradeExecuted(type.name());
            log.info("Trade committed user={} txn={} {} {} x {} @ {} total={} balance={}",
                    userId, result.transactionId(), type, normalizedSymbol, quantity, price, totalAmount, result.newBalance());
            return result;
        } catch (TradingException e) {
            metricsService.recordTradeRejected(e.getKind().name());
            log.warn("Trade rejected user={} {} {} x {}: {}", userId, type, symbol, quantity, e.getMessage());
            throw e;
        }
    }

    private TradeResult commitUnderAccountLock(Long userId, String symbol, TransactionType type, int quantity,
                                               BigDecimal price, BigDecimal totalAmount) {
        acquireLock(userId);
        try {
            return transactionTemplate.execute(status -> apply(userId, symbol, type, quantity, price, totalAmount));
        } catch (TransactionException | DataAccessException | PersistenceException e) {
            throw new StoreFailureException("Trade could not be committed", e);
        } finally {
            lockRegistry.unlock(userId);
        }
    }

    private TradeResult apply(Long userId, String symbol, TransactionType type, int quantity,
                              BigDecimal price, BigDecimal totalAmount) {
        Account account = ledgerStore.lockAccount(userId);
        BigDecimal balance = account.getCashBalance();

        if (type == TransactionType.BUY) {
            if (balance.compareTo(totalAmount) < 0) {
                throw new InsufficientBalanceException("Insufficient balance");
            }
            account.setCashBalance(MoneyUtils.subtract(balance, totalAmount));
        } else {
            List<LedgerTransaction> history = ledgerStore.readTransactions(userId, symbol);
            long held = positionReplayer.netQuantity(history, symbol);
            if (held < quantity) {
                throw new InsufficientHoldingsException("Insufficient holdings");
            }
            account.setCashBalance(MoneyUtils.add(balance, totalAmount));
        }

        LedgerTransaction saved = ledgerStore.atomicCommit(account, LedgerTransaction.builder()
                .userId(userId)
                .symbol(symbol)
                .type(type)
                .quantity(quantity)
                .price(price)
                .totalAmount(totalAmount)
                .createdAt(clock.instant())
                .build());

        return new TradeResult(saved.getId(), symbol, type, quantity, price, totalAmount, account.getCashBalance());
    }

    private void acquireLock(Long userId) {
        boolean acquired;
        try {
            acquired = lockRegistry.tryLock(userId, commitTimeoutSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreFailureException("Interrupted while waiting for account lock", e);
        }
        if (!acquired) {
            throw new StoreFailureException("Timed out waiting for account lock", null);
        }
    }

    private BigDecimal fetchPrice(String symbol) {
        BigDecimal price;
        try {
            price = priceOracle.getPrice(symbol).orElseThrow(() -> new PriceUnavailableException(symbol));
        } catch (PriceUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PriceUnavailableException(symbol, e);
        }
        BigDecimal scaled = MoneyUtils.scale(price);
        if (!MoneyUtils.isPositive(scaled)) {
            throw new PriceUnavailableException(symbol);
        }
        return scaled;
    }

    private String validate(Long userId, String symbol, TransactionType type, Integer quantity) {
        if (userId == null) {
            throw new InvalidInputException("User id is required");
        }
        String normalized = symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            throw new InvalidInputException("Invalid symbol");
        }
        if (type == null) {
            throw new InvalidInputException("Invalid type. Must be BUY or SELL");
        }
        if (quantity == null || quantity < 1) {
            throw new InvalidInputException("Invalid quantity. Must be a positive number");
        }
        return normalized;
    }

    public record TradeResult(
            Long transactionId,
            String symbol,
            TransactionType type,
            int quantity,
            BigDecimal price,
            BigDecimal totalAmount,
            BigDecimal newBalance
    ) {}
}
