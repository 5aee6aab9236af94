package com.agrotrace.core.repository;

import com.agrotrace.core.domain.LedgerAccount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for local ledger balances.
 */
@Repository
public interface LedgerAccountRepository extends JpaRepository<LedgerAccount, String> {
}
