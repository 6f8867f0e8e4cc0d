package com.flagship.accounting_ledger.journal;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface JournalLineItemRepository extends JpaRepository<JournalLineItemEntity, UUID> {

    boolean existsByAccountId(UUID accountId);
}
