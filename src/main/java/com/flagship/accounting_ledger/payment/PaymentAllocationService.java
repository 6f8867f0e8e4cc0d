package com.flagship.accounting_ledger.payment;

import com.flagship.accounting_ledger.bill.BillRepository;
import com.flagship.accounting_ledger.document.BillableDocument;
import com.flagship.accounting_ledger.document.BillableDocumentEntity;
import com.flagship.accounting_ledger.document.BillableKind;
import com.flagship.accounting_ledger.event.PaymentEvent;
import com.flagship.accounting_ledger.exception.NotFoundException;
import com.flagship.accounting_ledger.exception.OverpaymentException;
import com.flagship.accounting_ledger.exception.ValidationException;
import com.flagship.accounting_ledger.invoice.InvoiceRepository;
import com.flagship.accounting_ledger.ledger.LedgerEffectApplier;
import com.flagship.accounting_ledger.ledger.LedgerEffects;
import com.flagship.accounting_ledger.numbering.DocumentNumberingService;
import com.flagship.accounting_ledger.numbering.DocumentType;
import com.flagship.accounting_ledger.observability.CorrelationContext;
import com.flagship.accounting_ledger.observability.LedgerMetrics;
import com.flagship.accounting_ledger.outbox.OutboxService;
import com.flagship.accounting_ledger.totals.Money;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Applies payments to invoices and bills, and reverses them.
 *
 * Applying a payment is one transaction containing:
 * <ol>
 *   <li>a row lock on the document (concurrent payments on it serialize here)</li>
 *   <li>a second idempotency key lookup, answering with the payment of a request that committed first</li>
 *   <li>the overpayment check against the locked balance</li>
 *   <li>the payment row</li>
 *   <li>the document's paid / balance / status update</li>
 *   <li>the counterparty balance delta (-amount)</li>
 *   <li>the PaymentApplied outbox event</li>
 * </ol>
 * Reversal (delete) is the mirror image.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentAllocationService {

    private final PaymentRepository paymentRepository;
    private final InvoiceRepository invoiceRepository;
    private final BillRepository billRepository;
    private final DocumentNumberingService numberingService;
    private final LedgerEffectApplier ledgerEffectApplier;
    private final OutboxService outboxService;
    private final IdempotencyService idempotencyService;
    private final LedgerMetrics ledgerMetrics;
    private final Clock clock;

    public Payment applyPayment(UUID companyId, ApplyPaymentCommand command) {
        DocumentRef ref = command.getDocumentRef() != null ? command.getDocumentRef() : new DocumentRef(null, null);
        BillableKind kind = ref.kind();
        BigDecimal amount = validateAmount(command.getAmount());
        if (command.getMethod() == null) {
            throw new ValidationException("Payment method is required");
        }
        LocalDate date = command.getDate() != null ? command.getDate() : LocalDate.now(clock);
        String idempotencyKey = blankToNull(command.getIdempotencyKey());

        if (idempotencyKey != null) {
            Optional<Payment> existing = findByIdempotencyKey(companyId, idempotencyKey);
            if (existing.isPresent()) {
                ledgerMetrics.recordIdempotencyHit();
                log.info("Idempotency key already used, returning payment {}", existing.get().getNumber());
                return existing.get();
            }
            ledgerMetrics.recordIdempotencyMiss();
        }

        long start = System.currentTimeMillis();
        Applied applied;
        try {
            applied = numberingService.insertWithNumber(companyId, DocumentType.PAYMENT, command.getNumber(),
                    number -> {
                        BillableDocumentEntity document = lockDocument(companyId, kind, ref.documentId());
                        // a request with the same key may have committed while we waited for the lock
                        if (idempotencyKey != null) {
                            Optional<Payment> winner = findByIdempotencyKey(companyId, idempotencyKey);
                            if (winner.isPresent()) {
                                return new Applied(winner.get(), true);
                            }
                        }
                        if (amount.compareTo(document.getBalanceAmount()) > 0) {
                            throw new OverpaymentException(amount, document.getBalanceAmount());
                        }

                        PaymentEntity saved = paymentRepository.saveAndFlush(PaymentEntity.create(
                                companyId, number, ref, amount, date, command.getMethod(),
                                command.getReferenceNumber(), command.getNotes(), idempotencyKey));

                        document.applyPayment(amount);
                        ledgerEffectApplier.apply(companyId, LedgerEffects.of(
                                kind.counterpartyEffect(document.getCounterpartyId(), amount.negate())));

                        BillableDocument snapshot = document.toDomain();
                        outboxService.saveEvent(PaymentEvent.of(PaymentEvent.APPLIED, saved.getId(), number,
                                amount, snapshot));
                        return new Applied(saved.toDomain(), false);
                    });
        } catch (DataIntegrityViolationException e) {
            if (idempotencyKey != null) {
                Optional<Payment> winner = findByIdempotencyKey(companyId, idempotencyKey);
                if (winner.isPresent()) {
                    log.info("Concurrent request with the same idempotency key won, returning payment {}",
                            winner.get().getNumber());
                    return winner.get();
                }
            }
            throw e;
        }

        Payment payment = applied.payment();
        if (applied.replayed()) {
            log.info("Concurrent request with the same idempotency key won, returning payment {}",
                    payment.getNumber());
            return payment;
        }

        if (idempotencyKey != null) {
            idempotencyService.remember(companyId, idempotencyKey, payment.getId());
        }

        CorrelationContext.document(ref.documentId());
        ledgerMetrics.recordPaymentApplied(kind.name());
        ledgerMetrics.recordLatency("apply_payment", System.currentTimeMillis() - start);
        log.info("Payment applied: number={}, {}={}, amount={}",
                payment.getNumber(), kind.getLabel(), ref.documentId(), amount);
        return payment;
    }

    /**
     * Reverses a payment: the document gets its paid amount back (returning to
     * SENT / APPROVED when nothing remains paid) and the counterparty balance
     * increases by the amount again.
     */
    @Transactional
    public void deletePayment(UUID companyId, UUID paymentId) {
        PaymentEntity payment = paymentRepository.findByIdAndCompanyIdForUpdate(paymentId, companyId)
                .orElseThrow(() -> new NotFoundException("Payment", paymentId));
        DocumentRef ref = payment.getDocumentRef();
        BillableKind kind = ref.kind();

        BillableDocumentEntity document = lockDocument(companyId, kind, ref.documentId());
        document.reversePayment(payment.getAmount());
        ledgerEffectApplier.apply(companyId, LedgerEffects.of(
                kind.counterpartyEffect(document.getCounterpartyId(), payment.getAmount())));

        paymentRepository.delete(payment);
        outboxService.saveEvent(PaymentEvent.of(PaymentEvent.REVERSED, payment.getId(), payment.getNumber(),
                payment.getAmount(), document.toDomain()));
        idempotencyService.forget(companyId, payment.getIdempotencyKey());

        ledgerMetrics.recordPaymentReversed(kind.name());
        log.info("Payment reversed: number={}, {}={}, amount={}, document status={}",
                payment.getNumber(), kind.getLabel(), ref.documentId(), payment.getAmount(), document.getStatus());
    }

    /**
     * Changes date, method, reference or notes. The amount is fixed.
     */
    @Transactional
    public Payment updatePayment(UUID companyId, UUID paymentId, LocalDate date, PaymentMethod method,
                                 String referenceNumber, String notes) {
        PaymentEntity payment = paymentRepository.findByIdAndCompanyId(paymentId, companyId)
                .orElseThrow(() -> new NotFoundException("Payment", paymentId));
        payment.updateDetails(date, method, referenceNumber, notes);
        PaymentEntity saved = paymentRepository.saveAndFlush(payment);
        log.info("Payment updated: number={}", saved.getNumber());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Payment get(UUID companyId, UUID paymentId) {
        return paymentRepository.findByIdAndCompanyId(paymentId, companyId)
                .map(PaymentEntity::toDomain)
                .orElseThrow(() -> new NotFoundException("Payment", paymentId));
    }

    @Transactional(readOnly = true)
    public List<Payment> list(UUID companyId, UUID invoiceId, UUID billId) {
        List<PaymentEntity> payments;
        if (invoiceId != null) {
            payments = paymentRepository.findAllByCompanyIdAndInvoiceIdOrderByPaymentDateAsc(companyId, invoiceId);
        } else if (billId != null) {
            payments = paymentRepository.findAllByCompanyIdAndBillIdOrderByPaymentDateAsc(companyId, billId);
        } else {
            payments = paymentRepository.findAllByCompanyIdOrderByPaymentDateDescNumberDesc(companyId);
        }
        return payments.stream().map(PaymentEntity::toDomain).toList();
    }

    private BillableDocumentEntity lockDocument(UUID companyId, BillableKind kind, UUID documentId) {
        Optional<? extends BillableDocumentEntity> document = kind == BillableKind.INVOICE
                ? invoiceRepository.findByIdAndCompanyIdForUpdate(documentId, companyId)
                : billRepository.findByIdAndCompanyIdForUpdate(documentId, companyId);
        return document.orElseThrow(() -> new NotFoundException(kind.getLabel(), documentId));
    }

    private Optional<Payment> findByIdempotencyKey(UUID companyId, String idempotencyKey) {
        return idempotencyService.findPaymentId(companyId, idempotencyKey)
                .flatMap(id -> paymentRepository.findByIdAndCompanyId(id, companyId))
                .map(PaymentEntity::toDomain);
    }

    private record Applied(Payment payment, boolean replayed) {
    }

    private static BigDecimal validateAmount(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException("Payment amount must be greater than 0");
        }
        if (amount.stripTrailingZeros().scale() > Money.SCALE) {
            throw new ValidationException("Payment amount has more than " + Money.SCALE + " decimal places");
        }
        return Money.normalize(amount);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
