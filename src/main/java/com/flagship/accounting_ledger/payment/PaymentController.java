package com.flagship.accounting_ledger.payment;

import com.flagship.accounting_ledger.payment.dto.CreatePaymentRequest;
import com.flagship.accounting_ledger.payment.dto.PaymentResponse;
import com.flagship.accounting_ledger.payment.dto.UpdatePaymentRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Payments against invoices and bills.
 *
 * POST accepts an optional Idempotency-Key header: repeating a request with
 * the same key returns the payment created the first time.
 */
@RestController
@RequestMapping("/api/companies/{companyId}/payments")
@RequiredArgsConstructor
@Slf4j
public class PaymentController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final PaymentAllocationService allocationService;

    @PostMapping
    public ResponseEntity<PaymentResponse> applyPayment(
            @PathVariable UUID companyId,
            @Valid @RequestBody CreatePaymentRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        log.info("Received payment request: invoiceId={}, billId={}, amount={}, idempotencyKey={}",
                request.getInvoiceId(), request.getBillId(), request.getAmount(), idempotencyKey);

        Payment payment = allocationService.applyPayment(companyId, ApplyPaymentCommand.builder()
                .documentRef(new DocumentRef(request.getInvoiceId(), request.getBillId()))
                .amount(request.getAmount())
                .method(request.getPaymentMethod())
                .date(request.getPaymentDate())
                .number(request.getPaymentNumber())
                .referenceNumber(request.getReferenceNumber())
                .notes(request.getNotes())
                .idempotencyKey(idempotencyKey)
                .build());

        return ResponseEntity.status(HttpStatus.CREATED).body(PaymentResponse.from(payment));
    }

    @GetMapping
    public List<PaymentResponse> list(@PathVariable UUID companyId,
                                      @RequestParam(name = "invoice_id", required = false) UUID invoiceId,
                                      @RequestParam(name = "bill_id", required = false) UUID billId) {
        return allocationService.list(companyId, invoiceId, billId).stream().map(PaymentResponse::from).toList();
    }

    @GetMapping("/{id}")
    public PaymentResponse get(@PathVariable UUID companyId, @PathVariable UUID id) {
        return PaymentResponse.from(allocationService.get(companyId, id));
    }

    @PatchMapping("/{id}")
    public PaymentResponse update(@PathVariable UUID companyId, @PathVariable UUID id,
                                  @RequestBody UpdatePaymentRequest request) {
        return PaymentResponse.from(allocationService.updatePayment(companyId, id, request.getPaymentDate(),
                request.getPaymentMethod(), request.getReferenceNumber(), request.getNotes()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID companyId, @PathVariable UUID id) {
        allocationService.deletePayment(companyId, id);
        return ResponseEntity.noContent().build();
    }
}
