package com.flagship.accounting_ledger.invoice;

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
public interface InvoiceRepository extends JpaRepository<InvoiceEntity, UUID> {

    Optional<InvoiceEntity> findByIdAndCompanyId(UUID id, UUID companyId);

    /**
     * Row-locks the invoice. Payments, updates and deletes of one invoice serialize here.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM InvoiceEntity i WHERE i.id = :id AND i.companyId = :companyId")
    Optional<InvoiceEntity> findByIdAndCompanyIdForUpdate(@Param("id") UUID id, @Param("companyId") UUID companyId);

    Page<InvoiceEntity> findAllByCompanyId(UUID companyId, Pageable pageable);

    boolean existsByCompanyIdAndCustomerId(UUID companyId, UUID customerId);
}
