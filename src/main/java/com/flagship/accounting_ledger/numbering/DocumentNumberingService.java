package com.flagship.accounting_ledger.numbering;

import com.flagship.accounting_ledger.exception.DuplicateCodeException;
import com.flagship.accounting_ledger.exception.StorageException;
import com.flagship.accounting_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;
import java.util.function.Function;

/**
 * Issues unique, gap-tolerant sequential numbers per company and document type.
 *
 * The next sequence is one past the highest generated number in use for the
 * company and type (and year, for year-scoped types). Deleted documents leave
 * gaps that are never refilled. Reading the maximum is racy on its own: two
 * concurrent callers can see the same value. The race is closed by the
 * unique (company_id, number) constraint on each table plus a bounded retry:
 * <ol>
 *   <li>derive a candidate number (highest sequence + 1, never below the last candidate)</li>
 *   <li>run the caller's insert in a fresh transaction and flush it</li>
 *   <li>on a uniqueness violation roll the attempt back and try the next number</li>
 * </ol>
 * Each attempt is a complete unit of work: the caller's callback performs the
 * document insert together with its ledger effects and outbox event, so a
 * retried attempt leaves nothing behind.
 *
 * A number supplied by the caller is never replaced: if it is taken the
 * operation fails immediately with {@link DuplicateCodeException}. Integrity
 * violations unrelated to the number are rethrown untouched.
 */
@Service
@Slf4j
public class DocumentNumberingService {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final LedgerMetrics ledgerMetrics;

    @Value("${ledger.numbering.max-attempts:5}")
    private int maxAttempts = 5;

    @Value("${ledger.numbering.pad-width:6}")
    private int padWidth = 6;

    public DocumentNumberingService(JdbcTemplate jdbcTemplate,
                                    PlatformTransactionManager transactionManager,
                                    Clock clock,
                                    LedgerMetrics ledgerMetrics) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
        this.ledgerMetrics = ledgerMetrics;
    }

    /**
     * Derives the next candidate number without reserving it.
     */
    public String issue(UUID companyId, DocumentType type) {
        return format(type, highestSequence(companyId, type) + 1);
    }

    /**
     * Inserts a numbered record, retrying with a fresh number on collision.
     *
     * @param companyId       tenant scope
     * @param type            document type deciding prefix and table
     * @param requestedNumber caller-supplied number, or null to generate one
     * @param insert          unit of work receiving the number; must flush its insert
     * @return whatever the callback returned for the successful attempt
     * @throws DuplicateCodeException if the requested number is taken or retries are exhausted
     */
    public <T> T insertWithNumber(UUID companyId, DocumentType type, String requestedNumber,
                                  Function<String, T> insert) {
        boolean callerSupplied = requestedNumber != null && !requestedNumber.isBlank();
        String number = null;
        long lastSequence = 0;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (callerSupplied) {
                number = requestedNumber.trim();
            } else {
                lastSequence = Math.max(highestSequence(companyId, type), lastSequence) + 1;
                number = format(type, lastSequence);
            }

            if (exists(companyId, type, number)) {
                if (callerSupplied) {
                    throw new DuplicateCodeException(companyId, number);
                }
                log.debug("Number {} already taken for company {}, trying next", number, companyId);
                ledgerMetrics.recordNumberingRetry(type.name());
                continue;
            }

            final String candidate = number;
            try {
                return transactionTemplate.execute(status -> insert.apply(candidate));
            } catch (DataIntegrityViolationException e) {
                if (!exists(companyId, type, candidate)) {
                    // some other constraint; not ours to retry
                    throw e;
                }
                if (callerSupplied) {
                    throw new DuplicateCodeException(companyId, candidate);
                }
                log.warn("Number collision on {} for company {} (attempt {}/{}), retrying",
                        candidate, companyId, attempt, maxAttempts);
                ledgerMetrics.recordNumberingRetry(type.name());
            }
        }

        throw new DuplicateCodeException(companyId, number, maxAttempts);
    }

    String format(DocumentType type, long sequence) {
        String padded = String.format("%0" + padWidth + "d", sequence);
        if (type.isYearScoped()) {
            return type.getPrefix() + "-" + LocalDate.now(clock).getYear() + "-" + padded;
        }
        return type.getPrefix() + "-" + padded;
    }

    /**
     * Highest numeric suffix among this company's generated numbers of the
     * type, or 0. Caller-supplied numbers outside the generated pattern are ignored.
     */
    private long highestSequence(UUID companyId, DocumentType type) {
        String column = type.getNumberColumn();
        String pattern = generatedPattern(type);
        try {
            Long highest = jdbcTemplate.queryForObject(
                "SELECT COALESCE(MAX(CAST(SUBSTRING(" + column + " FROM ?) AS BIGINT)), 0) FROM "
                    + type.getTable() + " WHERE company_id = ? AND " + column + " ~ ?",
                Long.class,
                pattern,
                companyId,
                pattern
            );
            return highest == null ? 0 : highest;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read the last " + type.getTable() + " number for company "
                    + companyId, e);
        }
    }

    /**
     * POSIX regex matching generated numbers, capturing the sequence. At most
     * 18 digits so the suffix always fits a BIGINT.
     */
    String generatedPattern(DocumentType type) {
        String prefix = type.isYearScoped()
                ? type.getPrefix() + "-" + LocalDate.now(clock).getYear() + "-"
                : type.getPrefix() + "-";
        return "^" + prefix + "([0-9]{1,18})$";
    }

    private boolean exists(UUID companyId, DocumentType type, String number) {
        try {
            Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM " + type.getTable() + " WHERE company_id = ? AND "
                    + type.getNumberColumn() + " = ?",
                Long.class,
                companyId,
                number
            );
            return count != null && count > 0;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to check " + type.getTable() + " number " + number, e);
        }
    }
}
