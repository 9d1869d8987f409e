package com.simfolio.backend.repository;

import com.simfolio.backend.model.LedgerTransaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LedgerTransactionRepository extends JpaRepository<LedgerTransaction, Long> {
    List<LedgerTransaction> findByUserIdOrderByCreatedAtAscIdAsc(Long userId);

    List<LedgerTransaction> findByUserIdAndSymbolOrderByCreatedAtAscIdAsc(Long userId, String symbol);

    long countByUserId(Long userId);
}
