package com.flagship.accounting_ledger.payment;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PaymentRepository extends JpaRepository<PaymentEntity, UUID> {

    Optional<PaymentEntity> findByIdAndCompanyId(UUID id, UUID companyId);

    /**
     * Locks the payment so a concurrent reversal of the same payment waits and then finds nothing.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PaymentEntity p WHERE p.id = :id AND p.companyId = :companyId")
    Optional<PaymentEntity> findByIdAndCompanyIdForUpdate(@Param("id") UUID id, @Param("companyId") UUID companyId);

    Optional<PaymentEntity> findByCompanyIdAndIdempotencyKey(UUID companyId, String idempotencyKey);

    List<PaymentEntity> findAllByCompanyIdOrderByPaymentDateDescNumberDesc(UUID companyId);

    List<PaymentEntity> findAllByCompanyIdAndInvoiceIdOrderByPaymentDateAsc(UUID companyId, UUID invoiceId);

    List<PaymentEntity> findAllByCompanyIdAndBillIdOrderByPaymentDateAsc(UUID companyId, UUID billId);
}
