package com.flagship.accounting_ledger.expense;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ExpenseRepository extends JpaRepository<ExpenseEntity, UUID> {

    Optional<ExpenseEntity> findByIdAndCompanyId(UUID id, UUID companyId);

    Page<ExpenseEntity> findAllByCompanyId(UUID companyId, Pageable pageable);
}
