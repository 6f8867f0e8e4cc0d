package com.flagship.accounting_ledger.journal;

import com.flagship.accounting_ledger.journal.dto.JournalEntryRequest;
import com.flagship.accounting_ledger.journal.dto.JournalEntryResponse;
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
@RequestMapping("/api/companies/{companyId}/journal-entries")
@RequiredArgsConstructor
@Slf4j
public class JournalController {

    private final JournalService journalService;

    @PostMapping
    public ResponseEntity<JournalEntryResponse> create(@PathVariable UUID companyId,
                                                       @RequestBody JournalEntryRequest request) {
        log.info("Received journal entry request: post={}, lines={}",
                request.shouldPost(), request.getLines() == null ? 0 : request.getLines().size());
        JournalEntry entry = request.shouldPost()
                ? journalService.post(companyId, request.toCommand())
                : journalService.saveDraft(companyId, request.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(JournalEntryResponse.from(entry));
    }

    @GetMapping
    public Page<JournalEntryResponse> list(@PathVariable UUID companyId,
                                           @RequestParam(defaultValue = "0") int page,
                                           @RequestParam(defaultValue = "20") int size) {
        PageRequest pageable = PageRequest.of(page, Math.min(size, 100),
                Sort.by(Sort.Direction.DESC, "entryDate", "number"));
        return journalService.list(companyId, pageable).map(JournalEntryResponse::from);
    }

    @GetMapping("/{id}")
    public JournalEntryResponse get(@PathVariable UUID companyId, @PathVariable UUID id) {
        return JournalEntryResponse.from(journalService.get(companyId, id));
    }

    @PutMapping("/{id}")
    public JournalEntryResponse updateDraft(@PathVariable UUID companyId, @PathVariable UUID id,
                                            @RequestBody JournalEntryRequest request) {
        return JournalEntryResponse.from(journalService.updateDraft(companyId, id, request.toCommand()));
    }

    @PostMapping("/{id}/post")
    public JournalEntryResponse postDraft(@PathVariable UUID companyId, @PathVariable UUID id) {
        return JournalEntryResponse.from(journalService.postDraft(companyId, id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteDraft(@PathVariable UUID companyId, @PathVariable UUID id) {
        journalService.deleteDraft(companyId, id);
        return ResponseEntity.noContent().build();
    }
}
