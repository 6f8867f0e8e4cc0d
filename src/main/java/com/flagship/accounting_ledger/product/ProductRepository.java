package com.flagship.accounting_ledger.product;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ProductRepository extends JpaRepository<ProductEntity, UUID> {

    Optional<ProductEntity> findByIdAndCompanyId(UUID id, UUID companyId);

    List<ProductEntity> findAllByCompanyIdAndIdIn(UUID companyId, Collection<UUID> ids);

    List<ProductEntity> findAllByCompanyIdOrderByCodeAsc(UUID companyId);
}
