package com.flagship.accounting_ledger.expense;

import com.flagship.accounting_ledger.expense.dto.ExpenseRequest;
import com.flagship.accounting_ledger.expense.dto.ExpenseResponse;
import lombok.RequiredArgsConstructor;
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
@RequestMapping("/api/companies/{companyId}/expenses")
@RequiredArgsConstructor
public class ExpenseController {

    private final ExpenseService expenseService;

    @PostMapping
    public ResponseEntity<ExpenseResponse> create(@PathVariable UUID companyId, @RequestBody ExpenseRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ExpenseResponse.from(expenseService.create(companyId, request.toCommand())));
    }

    @GetMapping
    public Page<ExpenseResponse> list(@PathVariable UUID companyId,
                                      @RequestParam(defaultValue = "0") int page,
                                      @RequestParam(defaultValue = "20") int size) {
        PageRequest pageable = PageRequest.of(page, Math.min(size, 100),
                Sort.by(Sort.Direction.DESC, "expenseDate", "number"));
        return expenseService.list(companyId, pageable).map(ExpenseResponse::from);
    }

    @GetMapping("/{id}")
    public ExpenseResponse get(@PathVariable UUID companyId, @PathVariable UUID id) {
        return ExpenseResponse.from(expenseService.get(companyId, id));
    }

    @PutMapping("/{id}")
    public ExpenseResponse update(@PathVariable UUID companyId, @PathVariable UUID id,
                                  @RequestBody ExpenseRequest request) {
        return ExpenseResponse.from(expenseService.update(companyId, id, request.toCommand()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID companyId, @PathVariable UUID id) {
        expenseService.delete(companyId, id);
        return ResponseEntity.noContent().build();
    }
}
