package com.flagship.accounting_ledger.invoice;

import com.flagship.accounting_ledger.document.BillableDocument;
import com.flagship.accounting_ledger.document.BillableDocumentCommand;
import com.flagship.accounting_ledger.document.BillableKind;
import com.flagship.accounting_ledger.document.DocumentStatus;
import com.flagship.accounting_ledger.document.LineItemCommand;
import com.flagship.accounting_ledger.document.LineItemPricer;
import com.flagship.accounting_ledger.event.LedgerEvent;
import com.flagship.accounting_ledger.exception.EmptyDocumentException;
import com.flagship.accounting_ledger.exception.HasPaymentsException;
import com.flagship.accounting_ledger.exception.ImmutableStateException;
import com.flagship.accounting_ledger.exception.OverpaymentException;
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
import java.time.LocalDate;
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
 * Invoice lifecycle with the store mocked out: checks totals, status and the
 * customer balance deltas each operation hands to the ledger.
 */
@ExtendWith(MockitoExtension.class)
class InvoiceServiceTest {

    @Mock
    private InvoiceRepository invoiceRepository;

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

    private LineItemPricer lineItemPricer;
    private InvoiceService invoiceService;

    private final UUID companyId = UUID.randomUUID();
    private final UUID customerId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        lineItemPricer = new LineItemPricer(productRepository, new LineItemTotalsCalculator());
        Clock clock = Clock.fixed(Instant.parse("2026-03-15T10:00:00Z"), ZoneOffset.UTC);
        invoiceService = new InvoiceService(invoiceRepository, partyService, numberingService, lineItemPricer,
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
                .description("Consulting")
                .quantity(new BigDecimal(quantity))
                .unitPrice(new BigDecimal(unitPrice))
                .taxRate(new BigDecimal(taxRate))
                .build();
    }

    @SuppressWarnings("unchecked")
    private void stubNumbering() {
        when(numberingService.insertWithNumber(eq(companyId), eq(DocumentType.INVOICE), isNull(), any()))
                .thenAnswer(invocation -> ((Function<String, Object>) invocation.getArgument(3))
                        .apply("INV-2026-000001"));
    }

    private void stubSave() {
        when(invoiceRepository.saveAndFlush(any(InvoiceEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    private InvoiceEntity existingInvoice(List<LineItemCommand> items, String paid) {
        InvoiceEntity invoice = InvoiceEntity.create(companyId, customerId, "INV-2026-000001",
                LocalDate.of(2026, 3, 1), LocalDate.of(2026, 3, 31), DocumentStatus.SENT, null, null);
        invoice.applyItems(lineItemPricer.price(BillableKind.INVOICE, companyId, items, null));
        if (paid != null) {
            invoice.applyPayment(new BigDecimal(paid));
        }
        return invoice;
    }

    private LedgerEffects capturedEffects() {
        ArgumentCaptor<LedgerEffects> captor = ArgumentCaptor.forClass(LedgerEffects.class);
        verify(ledgerEffectApplier).apply(eq(companyId), captor.capture());
        return captor.getValue();
    }

    @Test
    @DisplayName("Create computes totals and raises the customer balance by the total")
    void testCreateInvoice() {
        printTestHeader("Create Invoice");
        stubNumbering();
        stubSave();

        BillableDocument invoice = invoiceService.create(companyId, BillableDocumentCommand.builder()
                .counterpartyId(customerId)
                .items(List.of(item("2", "100", "10")))
                .build());

        System.out.println("Created: " + invoice.getNumber() + " total=" + invoice.getTotalAmount());
        assertEquals("INV-2026-000001", invoice.getNumber());
        assertEquals(DocumentStatus.DRAFT, invoice.getStatus());
        assertEquals(0, new BigDecimal("200").compareTo(invoice.getSubtotal()));
        assertEquals(0, new BigDecimal("20").compareTo(invoice.getTaxAmount()));
        assertEquals(0, new BigDecimal("220").compareTo(invoice.getTotalAmount()));
        assertEquals(0, new BigDecimal("220").compareTo(invoice.getBalanceAmount()));
        assertEquals(LocalDate.of(2026, 3, 15), invoice.getDate());
        assertEquals(LocalDate.of(2026, 4, 14), invoice.getDueDate());

        verify(partyService).requireExists(PartyKind.CUSTOMER, companyId, customerId);
        assertEquals(0, new BigDecimal("220").compareTo(
                capturedEffects().deltaFor(BalanceTarget.CUSTOMER, customerId)));

        ArgumentCaptor<LedgerEvent> event = ArgumentCaptor.forClass(LedgerEvent.class);
        verify(outboxService).saveEvent(event.capture());
        assertEquals("InvoiceCreated", event.getValue().getEventType());
        printSuccess("Totals, balance delta and event are consistent");
    }

    @Test
    @DisplayName("An invoice without items is rejected before a number is taken")
    void testCreateWithoutItems() {
        printTestHeader("Create Without Items");

        assertThrows(EmptyDocumentException.class, () -> invoiceService.create(companyId,
                BillableDocumentCommand.builder().counterpartyId(customerId).items(List.of()).build()));

        verify(numberingService, never()).insertWithNumber(any(), any(), any(), any());
        verify(ledgerEffectApplier, never()).apply(any(), any());
    }

    @Test
    @DisplayName("Customer, issue status and due date are validated")
    void testCreateValidation() {
        printTestHeader("Create Validation");
        List<LineItemCommand> items = List.of(item("1", "10", "0"));

        assertThrows(ValidationException.class, () -> invoiceService.create(companyId,
                BillableDocumentCommand.builder().items(items).build()));
        assertThrows(ValidationException.class, () -> invoiceService.create(companyId,
                BillableDocumentCommand.builder().counterpartyId(customerId).items(items)
                        .status(DocumentStatus.APPROVED).build()));
        assertThrows(ValidationException.class, () -> invoiceService.create(companyId,
                BillableDocumentCommand.builder().counterpartyId(customerId).items(items)
                        .date(LocalDate.of(2026, 3, 10)).dueDate(LocalDate.of(2026, 3, 1)).build()));

        verify(numberingService, never()).insertWithNumber(any(), any(), any(), any());
    }

    @Test
    @DisplayName("Updating items moves the customer balance by the balance difference")
    void testUpdateItemsOnPartiallyPaidInvoice() {
        printTestHeader("Update Partially Paid Invoice");
        InvoiceEntity invoice = existingInvoice(List.of(item("2", "100", "10")), "50");
        assertEquals(DocumentStatus.PARTIALLY_PAID, invoice.getStatus());
        when(invoiceRepository.findByIdAndCompanyIdForUpdate(invoice.getId(), companyId)).thenReturn(Optional.of(invoice));
        stubSave();

        BillableDocument updated = invoiceService.update(companyId, invoice.getId(), BillableDocumentCommand.builder()
                .items(List.of(item("1", "100", "10")))
                .build());

        System.out.println("Updated: total=" + updated.getTotalAmount() + " balance=" + updated.getBalanceAmount());
        assertEquals(0, new BigDecimal("110").compareTo(updated.getTotalAmount()));
        assertEquals(0, new BigDecimal("60").compareTo(updated.getBalanceAmount()));
        assertEquals(DocumentStatus.PARTIALLY_PAID, updated.getStatus());
        // old balance 170, new balance 60
        assertEquals(0, new BigDecimal("-110").compareTo(
                capturedEffects().deltaFor(BalanceTarget.CUSTOMER, customerId)));
        printSuccess("Customer balance follows the document balance");
    }

    @Test
    @DisplayName("Reassigning the customer moves the open balance between customers")
    void testReassignCustomer() {
        printTestHeader("Reassign Customer");
        UUID otherCustomer = UUID.randomUUID();
        InvoiceEntity invoice = existingInvoice(List.of(item("2", "100", "10")), null);
        when(invoiceRepository.findByIdAndCompanyIdForUpdate(invoice.getId(), companyId)).thenReturn(Optional.of(invoice));
        stubSave();

        invoiceService.update(companyId, invoice.getId(), BillableDocumentCommand.builder()
                .counterpartyId(otherCustomer)
                .build());

        verify(partyService).requireExists(PartyKind.CUSTOMER, companyId, otherCustomer);
        LedgerEffects effects = capturedEffects();
        assertEquals(0, new BigDecimal("-220").compareTo(effects.deltaFor(BalanceTarget.CUSTOMER, customerId)));
        assertEquals(0, new BigDecimal("220").compareTo(effects.deltaFor(BalanceTarget.CUSTOMER, otherCustomer)));
        printSuccess("Balance moved to the new customer");
    }

    @Test
    @DisplayName("The total cannot drop below the paid amount")
    void testUpdateBelowPaidAmount() {
        printTestHeader("Update Below Paid Amount");
        InvoiceEntity invoice = existingInvoice(List.of(item("2", "100", "10")), "150");
        when(invoiceRepository.findByIdAndCompanyIdForUpdate(invoice.getId(), companyId)).thenReturn(Optional.of(invoice));

        assertThrows(OverpaymentException.class, () -> invoiceService.update(companyId, invoice.getId(),
                BillableDocumentCommand.builder().items(List.of(item("1", "100", "10"))).build()));

        verify(ledgerEffectApplier, never()).apply(any(), any());
    }

    @Test
    @DisplayName("A paid invoice cannot be modified")
    void testUpdatePaidInvoice() {
        printTestHeader("Update Paid Invoice");
        InvoiceEntity invoice = existingInvoice(List.of(item("2", "100", "10")), "220");
        assertEquals(DocumentStatus.PAID, invoice.getStatus());
        when(invoiceRepository.findByIdAndCompanyIdForUpdate(invoice.getId(), companyId)).thenReturn(Optional.of(invoice));

        assertThrows(ImmutableStateException.class, () -> invoiceService.update(companyId, invoice.getId(),
                BillableDocumentCommand.builder().notes("late note").build()));
    }

    @Test
    @DisplayName("Deleting an invoice with payments is refused")
    void testDeleteWithPayments() {
        printTestHeader("Delete With Payments");
        InvoiceEntity invoice = existingInvoice(List.of(item("2", "100", "10")), "10");
        when(invoiceRepository.findByIdAndCompanyIdForUpdate(invoice.getId(), companyId)).thenReturn(Optional.of(invoice));

        assertThrows(HasPaymentsException.class, () -> invoiceService.delete(companyId, invoice.getId()));

        verify(invoiceRepository, never()).delete(any());
        verify(ledgerEffectApplier, never()).apply(any(), any());
    }

    @Test
    @DisplayName("Deleting an unpaid invoice releases its balance")
    void testDeleteUnpaid() {
        printTestHeader("Delete Unpaid");
        InvoiceEntity invoice = existingInvoice(List.of(item("2", "100", "10")), null);
        when(invoiceRepository.findByIdAndCompanyIdForUpdate(invoice.getId(), companyId)).thenReturn(Optional.of(invoice));

        invoiceService.delete(companyId, invoice.getId());

        verify(invoiceRepository).delete(invoice);
        assertEquals(0, new BigDecimal("-220").compareTo(
                capturedEffects().deltaFor(BalanceTarget.CUSTOMER, customerId)));
        printSuccess("Customer balance reduced by the open balance");
    }
}
