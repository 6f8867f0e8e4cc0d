package com.flagship.accounting_ledger.bill;

import com.flagship.accounting_ledger.document.BillableDocument;
import com.flagship.accounting_ledger.document.BillableDocumentCommand;
import com.flagship.accounting_ledger.document.DocumentStatus;
import com.flagship.accounting_ledger.document.LineItemCommand;
import com.flagship.accounting_ledger.document.LineItemPricer;
import com.flagship.accounting_ledger.event.LedgerEvent;
import com.flagship.accounting_ledger.exception.HasPaymentsException;
import com.flagship.accounting_ledger.exception.ImmutableStateException;
import com.flagship.accounting_ledger.exception.ValidationException;
import com.flagship.accounting_ledger.ledger.BalanceTarget;
import com.flagship.accounting_ledger.ledger.LedgerEffectApplier;
import com.flagship.accounting_ledger.ledger.LedgerEffects;
import com.flagship.accounting_ledger.numbering.DocumentNumberingService;
import com.flagship.accounting_ledger.numbering.DocumentType;
import com.flagship.accounting_ledger.observability.LedgerMetrics;
import com.flagship.accounting_ledger.outbox.OutboxService;
import com.flagship.accounting_ledger.party.PartyKind;
import com.flagship.accounting_ledger.party.PartyService;
import com.flagship.accounting_ledger.product.ProductRepository;
import com.flagship.accounting_ledger.totals.LineItemTotalsCalculator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Bill lifecycle against mocked storage. Bills move the supplier's payable
 * balance and are issued as APPROVED.
 */
@ExtendWith(MockitoExtension.class)
class BillServiceTest {

    @Mock
    private BillRepository billRepository;

    @Mock
    private PartyService partyService;

    @Mock
    private DocumentNumberingService numberingService;

    @Mock
    private LedgerEffectApplier ledgerEffectApplier;

    @Mock
    private OutboxService outboxService;

    @Mock
    private ProductRepository productRepository;

    private BillService billService;

    private final UUID companyId = UUID.randomUUID();
    private final UUID supplierId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        LineItemPricer lineItemPricer = new LineItemPricer(productRepository, new LineItemTotalsCalculator());
        Clock clock = Clock.fixed(Instant.parse("2026-03-15T10:00:00Z"), ZoneOffset.UTC);
        billService = new BillService(billRepository, partyService, numberingService, lineItemPricer,
                ledgerEffectApplier, outboxService, new LedgerMetrics(new SimpleMeterRegistry()), clock);
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private static LineItemCommand item(String quantity, String unitPrice, String taxRate) {
        return LineItemCommand.builder()
                .description("Office supplies")
                .quantity(new BigDecimal(quantity))
                .unitPrice(new BigDecimal(unitPrice))
                .taxRate(new BigDecimal(taxRate))
                .build();
    }

    @SuppressWarnings("unchecked")
    private void stubNumbering() {
        when(numberingService.insertWithNumber(eq(companyId), eq(DocumentType.BILL), isNull(), any()))
                .thenAnswer(invocation -> ((Function<String, Object>) invocation.getArgument(3))
                        .apply("BILL-2026-000001"));
    }

    private void stubSave() {
        when(billRepository.saveAndFlush(any(BillEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    private BillEntity existingBill(String total, String paid) {
        BillEntity bill = BillFixtures.approvedBill(companyId, supplierId, total);
        if (paid != null) {
            bill.applyPayment(new BigDecimal(paid));
        }
        when(billRepository.findByIdAndCompanyIdForUpdate(bill.getId(), companyId)).thenReturn(Optional.of(bill));
        return bill;
    }

    private LedgerEffects capturedEffects() {
        ArgumentCaptor<LedgerEffects> captor = ArgumentCaptor.forClass(LedgerEffects.class);
        verify(ledgerEffectApplier).apply(eq(companyId), captor.capture());
        return captor.getValue();
    }

    @Test
    @DisplayName("Create as APPROVED raises the supplier payable by the total")
    void testCreateApprovedBill() {
        printTestHeader("Create Approved Bill");
        stubNumbering();
        stubSave();

        BillableDocument bill = billService.create(companyId, BillableDocumentCommand.builder()
                .counterpartyId(supplierId)
                .status(DocumentStatus.APPROVED)
                .items(List.of(item("4", "25", "10")))
                .build());

        System.out.println("Created: " + bill.getNumber() + " total=" + bill.getTotalAmount());
        assertEquals("BILL-2026-000001", bill.getNumber());
        assertEquals(DocumentStatus.APPROVED, bill.getStatus());
        assertEquals(0, new BigDecimal("110").compareTo(bill.getTotalAmount()));
        assertEquals(0, new BigDecimal("110").compareTo(bill.getBalanceAmount()));

        verify(partyService).requireExists(PartyKind.SUPPLIER, companyId, supplierId);
        LedgerEffects effects = capturedEffects();
        assertEquals(0, new BigDecimal("110").compareTo(effects.deltaFor(BalanceTarget.SUPPLIER, supplierId)));
        assertEquals(0, BigDecimal.ZERO.compareTo(effects.deltaFor(BalanceTarget.CUSTOMER, supplierId)));

        ArgumentCaptor<LedgerEvent> event = ArgumentCaptor.forClass(LedgerEvent.class);
        verify(outboxService).saveEvent(event.capture());
        assertEquals("BillCreated", event.getValue().getEventType());
        printSuccess("Supplier payable raised and BillCreated recorded");
    }

    @Test
    @DisplayName("SENT is the invoice issue status and is refused for a new bill")
    void testCreateAsSentRejected() {
        printTestHeader("Create Bill As Sent");

        assertThrows(ValidationException.class, () -> billService.create(companyId,
                BillableDocumentCommand.builder()
                        .counterpartyId(supplierId)
                        .status(DocumentStatus.SENT)
                        .items(List.of(item("1", "10", "0")))
                        .build()));

        verify(numberingService, never()).insertWithNumber(any(), any(), any(), any());
        verify(ledgerEffectApplier, never()).apply(any(), any());
    }

    @Test
    @DisplayName("Updating items on a partially paid bill moves the supplier payable by the balance difference")
    void testUpdateItemsOnPartiallyPaidBill() {
        printTestHeader("Update Partially Paid Bill");
        BillEntity bill = existingBill("200", "50");
        assertEquals(DocumentStatus.PARTIALLY_PAID, bill.getStatus());
        stubSave();

        BillableDocument updated = billService.update(companyId, bill.getId(), BillableDocumentCommand.builder()
                .items(List.of(item("1", "120", "0")))
                .build());

        System.out.println("Updated: total=" + updated.getTotalAmount() + " balance=" + updated.getBalanceAmount());
        assertEquals(0, new BigDecimal("120").compareTo(updated.getTotalAmount()));
        assertEquals(0, new BigDecimal("70").compareTo(updated.getBalanceAmount()));
        assertEquals(DocumentStatus.PARTIALLY_PAID, updated.getStatus());
        // old balance 150, new balance 70
        assertEquals(0, new BigDecimal("-80").compareTo(
                capturedEffects().deltaFor(BalanceTarget.SUPPLIER, supplierId)));
        printSuccess("Supplier payable follows the bill balance");
    }

    @Test
    @DisplayName("A paid bill cannot be modified")
    void testUpdatePaidBill() {
        printTestHeader("Update Paid Bill");
        BillEntity bill = existingBill("200", "200");
        assertEquals(DocumentStatus.PAID, bill.getStatus());

        assertThrows(ImmutableStateException.class, () -> billService.update(companyId, bill.getId(),
                BillableDocumentCommand.builder().notes("late note").build()));

        verify(ledgerEffectApplier, never()).apply(any(), any());
    }

    @Test
    @DisplayName("Deleting a bill with payments is refused")
    void testDeleteWithPayments() {
        printTestHeader("Delete Bill With Payments");
        BillEntity bill = existingBill("200", "10");

        assertThrows(HasPaymentsException.class, () -> billService.delete(companyId, bill.getId()));

        verify(billRepository, never()).delete(any());
        verify(ledgerEffectApplier, never()).apply(any(), any());
    }

    @Test
    @DisplayName("Deleting an unpaid bill releases the supplier payable")
    void testDeleteUnpaid() {
        printTestHeader("Delete Unpaid Bill");
        BillEntity bill = existingBill("200", null);

        billService.delete(companyId, bill.getId());

        verify(billRepository).delete(bill);
        assertEquals(0, new BigDecimal("-200").compareTo(
                capturedEffects().deltaFor(BalanceTarget.SUPPLIER, supplierId)));
        ArgumentCaptor<LedgerEvent> event = ArgumentCaptor.forClass(LedgerEvent.class);
        verify(outboxService).saveEvent(event.capture());
        assertEquals("BillDeleted", event.getValue().getEventType());
        printSuccess("Supplier payable reduced by the open balance");
    }
}
