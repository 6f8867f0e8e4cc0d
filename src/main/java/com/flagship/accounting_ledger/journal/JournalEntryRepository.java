package com.flagship.accounting_ledger.journal;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface JournalEntryRepository extends JpaRepository<JournalEntryEntity, UUID> {

    Optional<JournalEntryEntity> findByIdAndCompanyId(UUID id, UUID companyId);

    /**
     * Row-locks the entry so a draft cannot be posted twice.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM JournalEntryEntity e WHERE e.id = :id AND e.companyId = :companyId")
    Optional<JournalEntryEntity> findByIdAndCompanyIdForUpdate(@Param("id") UUID id, @Param("companyId") UUID companyId);

    Page<JournalEntryEntity> findAllByCompanyId(UUID companyId, Pageable pageable);
}
