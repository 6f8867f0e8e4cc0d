package com.flagship.accounting_ledger.party;

import com.flagship.accounting_ledger.party.dto.CreatePartyRequest;
import com.flagship.accounting_ledger.party.dto.PartyResponse;
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
@RequestMapping("/api/companies/{companyId}")
@RequiredArgsConstructor
public class PartyController {

    private final PartyService partyService;

    @PostMapping("/customers")
    public ResponseEntity<PartyResponse> createCustomer(@PathVariable UUID companyId,
                                                        @Valid @RequestBody CreatePartyRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(PartyResponse.from(partyService.createCustomer(companyId, request)));
    }

    @GetMapping("/customers")
    public List<PartyResponse> listCustomers(@PathVariable UUID companyId) {
        return partyService.list(PartyKind.CUSTOMER, companyId).stream().map(PartyResponse::from).toList();
    }

    @GetMapping("/customers/{id}")
    public PartyResponse getCustomer(@PathVariable UUID companyId, @PathVariable UUID id) {
        return PartyResponse.from(partyService.get(PartyKind.CUSTOMER, companyId, id));
    }

    @DeleteMapping("/customers/{id}")
    public ResponseEntity<Void> deleteCustomer(@PathVariable UUID companyId, @PathVariable UUID id) {
        partyService.delete(PartyKind.CUSTOMER, companyId, id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/suppliers")
    public ResponseEntity<PartyResponse> createSupplier(@PathVariable UUID companyId,
                                                        @Valid @RequestBody CreatePartyRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(PartyResponse.from(partyService.createSupplier(companyId, request)));
    }

    @GetMapping("/suppliers")
    public List<PartyResponse> listSuppliers(@PathVariable UUID companyId) {
        return partyService.list(PartyKind.SUPPLIER, companyId).stream().map(PartyResponse::from).toList();
    }

    @GetMapping("/suppliers/{id}")
    public PartyResponse getSupplier(@PathVariable UUID companyId, @PathVariable UUID id) {
        return PartyResponse.from(partyService.get(PartyKind.SUPPLIER, companyId, id));
    }

    @DeleteMapping("/suppliers/{id}")
    public ResponseEntity<Void> deleteSupplier(@PathVariable UUID companyId, @PathVariable UUID id) {
        partyService.delete(PartyKind.SUPPLIER, companyId, id);
        return ResponseEntity.noContent().build();
    }
}
