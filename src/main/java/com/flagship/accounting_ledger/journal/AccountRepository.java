package com.flagship.accounting_ledger.journal;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AccountRepository extends JpaRepository<AccountEntity, UUID> {

    Optional<AccountEntity> findByIdAndCompanyId(UUID id, UUID companyId);

    List<AccountEntity> findAllByCompanyIdAndIdIn(UUID companyId, Collection<UUID> ids);

    List<AccountEntity> findAllByCompanyIdOrderByCodeAsc(UUID companyId);

    boolean existsByIdAndCompanyId(UUID id, UUID companyId);

    boolean existsByCompanyIdAndParentId(UUID companyId, UUID parentId);
}
