package com.flagship.accounting_ledger.bill;

import com.flagship.accounting_ledger.document.BillableDocument;
import com.flagship.accounting_ledger.document.dto.BillableDocumentResponse;
import com.flagship.accounting_ledger.bill.dto.CreateBillRequest;
import com.flagship.accounting_ledger.bill.dto.UpdateBillRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/companies/{companyId}/bills")
@RequiredArgsConstructor
@Slf4j
public class BillController {

    private final BillService billService;

    @PostMapping
    public ResponseEntity<BillableDocumentResponse> create(@PathVariable UUID companyId,
                                                           @Valid @RequestBody CreateBillRequest request) {
        log.info("Received bill creation request: supplierId={}", request.getSupplierId());
        BillableDocument bill = billService.create(companyId, request.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(respond(bill));
    }

    @GetMapping
    public Page<BillableDocumentResponse> list(@PathVariable UUID companyId,
                                               @RequestParam(defaultValue = "0") int page,
                                               @RequestParam(defaultValue = "20") int size) {
        PageRequest pageable = PageRequest.of(page, Math.min(size, 100),
                Sort.by(Sort.Direction.DESC, "date", "number"));
        return billService.list(companyId, pageable).map(this::respond);
    }

    @GetMapping("/{id}")
    public BillableDocumentResponse get(@PathVariable UUID companyId, @PathVariable UUID id) {
        return respond(billService.get(companyId, id));
    }

    @PutMapping("/{id}")
    public BillableDocumentResponse update(@PathVariable UUID companyId, @PathVariable UUID id,
                                           @Valid @RequestBody UpdateBillRequest request) {
        return respond(billService.update(companyId, id, request.toCommand()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID companyId, @PathVariable UUID id) {
        billService.delete(companyId, id);
        return ResponseEntity.noContent().build();
    }

    private BillableDocumentResponse respond(BillableDocument bill) {
        return BillableDocumentResponse.from(bill, billService.today());
    }
}
