package com.flagship.accounting_ledger.document;

import jakarta.persistence.Column;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Columns shared by invoice and bill items. Items are derived data: they are
 * written once from a {@link PricedLine} and replaced as a set, never edited.
 */
@MappedSuperclass
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public abstract class LineItemEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "product_id", updatable = false)
    private UUID productId;

    @Column(nullable = false, updatable = false)
    private int position;

    @Column(nullable = false, updatable = false)
    private String description;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal quantity;

    @Column(name = "unit_price", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal unitPrice;

    @Column(name = "tax_rate", nullable = false, updatable = false, precision = 9, scale = 4)
    private BigDecimal taxRate;

    @Column(name = "discount_amount", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal discountAmount;

    @Column(name = "tax_amount", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal taxAmount;

    @Column(name = "total_amount", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal totalAmount;

    protected LineItemEntity(int position, PricedLine line) {
        this.id = UUID.randomUUID();
        this.productId = line.getProductId();
        this.position = position;
        this.description = line.getDescription();
        this.quantity = line.getTotals().getQuantity();
        this.unitPrice = line.getTotals().getUnitPrice();
        this.taxRate = line.getTotals().getTaxRate();
        this.discountAmount = line.getTotals().getDiscountAmount();
        this.taxAmount = line.getTotals().getTaxAmount();
        this.totalAmount = line.getTotals().getTotalAmount();
    }

    public DocumentLine toDomain() {
        return new DocumentLine(id, productId, position, description, quantity, unitPrice,
                taxRate, discountAmount, taxAmount, totalAmount);
    }
}
