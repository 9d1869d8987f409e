package com.simfolio.backend.service.ledger;

import com.simfolio.backend.exception.AccountNotFoundException;
import com.simfolio.backend.model.Account;
import com.simfolio.backend.model.LedgerTransaction;
import com.simfolio.backend.repository.AccountRepository;
import com.simfolio.backend.repository.LedgerTransactionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Account record plus append-only transaction log. Reads are plain snapshot reads; the write
 * side only works inside an open store transaction so the balance update and the log append
 * commit or roll back together.
 */
@Service
@RequiredArgsConstructor
public class LedgerStore {

    private final AccountRepository accountRepository;
    private final LedgerTransactionRepository transactionRepository;

    @Transactional(readOnly = true)
    public Optional<Account> readAccount(Long userId) {
        return accountRepository.findByUserId(userId);
    }

    @Transactional(readOnly = true)
    public Account requireAccount(Long userId) {
        return accountRepository.findByUserId(userId)
                .orElseThrow(() -> new AccountNotFoundException(userId));
    }

    /**
     * Account and full log from one repeatable-read snapshot; never observes half a trade.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public LedgerSnapshot readLedger(Long userId) {
        Account account = requireAccount(userId);
        return new LedgerSnapshot(account, transactionRepository.findByUserIdOrderByCreatedAtAscIdAsc(userId));
    }

    /**
     * Full log for a user in commit order.
     */
    @Transactional(readOnly = true)
    public List<LedgerTransaction> readTransactions(Long userId) {
        return transactionRepository.findByUserIdOrderByCreatedAtAscIdAsc(userId);
    }

    @Transactional(readOnly = true)
    public List<LedgerTransaction> readTransactions(Long userId, String symbol) {
        return transactionRepository.findByUserIdAndSymbolOrderByCreatedAtAscIdAsc(userId, symbol);
    }

    /**
     * Loads the account with a row lock held until the current transaction ends.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Account lockAccount(Long userId) {
        return accountRepository.findForUpdateByUserId(userId)
                .orElseThrow(() -> new AccountNotFoundException(userId));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public LedgerTransaction atomicCommit(Account account, LedgerTransaction transaction) {
        accountRepository.saveAndFlush(account);
        return transactionRepository.saveAndFlush(transaction);
    }

    @Transactional
    public Account createAccount(Account account) {
        return accountRepository.saveAndFlush(account);
    }
}
