package com.flagship.accounting_ledger.document;

import com.flagship.accounting_ledger.exception.EmptyDocumentException;
import com.flagship.accounting_ledger.exception.NotFoundException;
import com.flagship.accounting_ledger.exception.ValidationException;
import com.flagship.accounting_ledger.product.ProductEntity;
import com.flagship.accounting_ledger.product.ProductRepository;
import com.flagship.accounting_ledger.totals.DocumentTotals;
import com.flagship.accounting_ledger.totals.LineItemInput;
import com.flagship.accounting_ledger.totals.LineItemTotalsCalculator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Fills product defaults into line items and computes document totals.
 *
 * A line with a product and no unit price takes the product's selling price
 * (invoices) or purchase price (bills); a missing tax rate or description
 * also comes from the product. Values given on the line always win.
 */
@Component
@RequiredArgsConstructor
public class LineItemPricer {

    private final ProductRepository productRepository;
    private final LineItemTotalsCalculator calculator;

    @Transactional(readOnly = true)
    public PricedItems price(BillableKind kind, UUID companyId, List<LineItemCommand> items,
                             BigDecimal documentDiscount) {
        if (items == null || items.isEmpty()) {
            throw new EmptyDocumentException(kind.getLabel());
        }

        Map<UUID, ProductEntity> products = loadProducts(companyId, items);

        List<LineItemInput> inputs = new ArrayList<>(items.size());
        List<String> descriptions = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            LineItemCommand item = items.get(i);
            if (item == null) {
                throw new ValidationException("Line " + (i + 1) + " is missing");
            }
            ProductEntity product = item.getProductId() == null ? null : products.get(item.getProductId());

            BigDecimal unitPrice = item.getUnitPrice();
            BigDecimal taxRate = item.getTaxRate();
            String description = item.getDescription();
            if (product != null) {
                if (unitPrice == null) {
                    unitPrice = kind == BillableKind.INVOICE ? product.getSellingPrice() : product.getPurchasePrice();
                }
                if (taxRate == null) {
                    taxRate = product.getTaxRate();
                }
                if (description == null || description.isBlank()) {
                    description = product.getName();
                }
            }
            if (description == null || description.isBlank()) {
                throw new ValidationException("Line " + (i + 1) + ": description is required");
            }

            inputs.add(LineItemInput.builder()
                    .quantity(item.getQuantity())
                    .unitPrice(unitPrice)
                    .taxRate(taxRate)
                    .discountAmount(item.getDiscountAmount())
                    .build());
            descriptions.add(description.trim());
        }

        DocumentTotals totals = calculator.calculate(kind.getLabel(), inputs, documentDiscount);

        List<PricedLine> lines = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            lines.add(new PricedLine(items.get(i).getProductId(), descriptions.get(i), totals.getLines().get(i)));
        }
        return new PricedItems(List.copyOf(lines), totals);
    }

    private Map<UUID, ProductEntity> loadProducts(UUID companyId, List<LineItemCommand> items) {
        Set<UUID> ids = items.stream()
                .filter(Objects::nonNull)
                .map(LineItemCommand::getProductId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        if (ids.isEmpty()) {
            return Map.of();
        }
        Map<UUID, ProductEntity> found = productRepository.findAllByCompanyIdAndIdIn(companyId, ids)
                .stream()
                .collect(Collectors.toMap(ProductEntity::getId, Function.identity()));
        for (UUID id : ids) {
            if (!found.containsKey(id)) {
                throw new NotFoundException("Product", id);
            }
        }
        return found;
    }
}
