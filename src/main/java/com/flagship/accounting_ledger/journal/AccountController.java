package com.flagship.accounting_ledger.journal;

import com.flagship.accounting_ledger.journal.dto.AccountResponse;
import com.flagship.accounting_ledger.journal.dto.CreateAccountRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/companies/{companyId}/accounts")
@RequiredArgsConstructor
public class AccountController {

    private final AccountService accountService;

    @PostMapping
    public ResponseEntity<AccountResponse> create(@PathVariable UUID companyId,
                                                  @Valid @RequestBody CreateAccountRequest request) {
        Account account = accountService.create(companyId, request.getCode(), request.getName(),
                request.getAccountType(), request.getParentId());
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }

    @GetMapping
    public List<AccountResponse> list(@PathVariable UUID companyId) {
        return accountService.list(companyId).stream().map(AccountResponse::from).toList();
    }

    @GetMapping("/{id}")
    public AccountResponse get(@PathVariable UUID companyId, @PathVariable UUID id) {
        return AccountResponse.from(accountService.get(companyId, id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID companyId, @PathVariable UUID id) {
        accountService.delete(companyId, id);
        return ResponseEntity.noContent().build();
    }
}
