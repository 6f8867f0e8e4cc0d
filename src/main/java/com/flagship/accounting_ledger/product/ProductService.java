package com.flagship.accounting_ledger.product;

import com.flagship.accounting_ledger.company.CompanyService;
import com.flagship.accounting_ledger.exception.NotFoundException;
import com.flagship.accounting_ledger.numbering.DocumentNumberingService;
import com.flagship.accounting_ledger.numbering.DocumentType;
import com.flagship.accounting_ledger.product.dto.CreateProductRequest;
import com.flagship.accounting_ledger.totals.Money;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class ProductService {

    private static final String DEFAULT_UNIT = "PCS";

    private final ProductRepository productRepository;
    private final CompanyService companyService;
    private final DocumentNumberingService numberingService;

    public ProductEntity create(UUID companyId, CreateProductRequest request) {
        companyService.requireExists(companyId);
        String unit = request.getUnit() == null || request.getUnit().isBlank() ? DEFAULT_UNIT : request.getUnit();

        ProductEntity product = numberingService.insertWithNumber(companyId, DocumentType.PRODUCT, request.getCode(),
                code -> productRepository.saveAndFlush(ProductEntity.create(companyId, code, request.getName().trim(),
                        unit,
                        Money.normalize(request.getSellingPrice()),
                        Money.normalize(request.getPurchasePrice()),
                        Money.normalize(request.getTaxRate()))));

        log.info("Product created: companyId={}, code={}", companyId, product.getCode());
        return product;
    }

    @Transactional(readOnly = true)
    public ProductEntity get(UUID companyId, UUID id) {
        return productRepository.findByIdAndCompanyId(id, companyId)
                .orElseThrow(() -> new NotFoundException("Product", id));
    }

    @Transactional(readOnly = true)
    public List<ProductEntity> list(UUID companyId) {
        return productRepository.findAllByCompanyIdOrderByCodeAsc(companyId);
    }
}
