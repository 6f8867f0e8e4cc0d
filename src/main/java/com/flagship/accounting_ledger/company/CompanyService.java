package com.flagship.accounting_ledger.company;

import com.flagship.accounting_ledger.exception.NotFoundException;
import com.flagship.accounting_ledger.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class CompanyService {

    private static final String DEFAULT_CURRENCY = "USD";

    private final CompanyRepository companyRepository;

    @Transactional
    public CompanyEntity create(String name, String email, String baseCurrency, String taxId) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Company name is required");
        }
        String currency = baseCurrency == null || baseCurrency.isBlank()
                ? DEFAULT_CURRENCY
                : baseCurrency.trim().toUpperCase(Locale.ROOT);
        if (!currency.matches("[A-Z]{3}")) {
            throw new ValidationException("Base currency must be a 3-letter ISO code");
        }

        CompanyEntity saved = companyRepository.save(CompanyEntity.create(name.trim(), email, currency, taxId));
        log.info("Company created: id={}, name={}", saved.getId(), saved.getName());
        return saved;
    }

    @Transactional(readOnly = true)
    public CompanyEntity get(UUID companyId) {
        return companyRepository.findById(companyId)
                .orElseThrow(() -> new NotFoundException("Company", companyId));
    }

    @Transactional(readOnly = true)
    public List<CompanyEntity> list() {
        return companyRepository.findAllByOrderByNameAsc();
    }

    /**
     * Fails with {@link NotFoundException} unless the company exists.
     */
    @Transactional(readOnly = true)
    public void requireExists(UUID companyId) {
        if (companyId == null || !companyRepository.existsById(companyId)) {
            throw new NotFoundException("Company", companyId);
        }
    }
}
