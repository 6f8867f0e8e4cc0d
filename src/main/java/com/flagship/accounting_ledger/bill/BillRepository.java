package com.flagship.accounting_ledger.bill;

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
public interface BillRepository extends JpaRepository<BillEntity, UUID> {

    Optional<BillEntity> findByIdAndCompanyId(UUID id, UUID companyId);

    /**
     * Row-locks the bill. Payments, updates and deletes of one bill serialize here.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM BillEntity b WHERE b.id = :id AND b.companyId = :companyId")
    Optional<BillEntity> findByIdAndCompanyIdForUpdate(@Param("id") UUID id, @Param("companyId") UUID companyId);

    Page<BillEntity> findAllByCompanyId(UUID companyId, Pageable pageable);

    boolean existsByCompanyIdAndSupplierId(UUID companyId, UUID supplierId);
}
