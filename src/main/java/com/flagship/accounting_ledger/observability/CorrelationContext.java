package com.flagship.accounting_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Request-scoped ids printed on every log line and stamped on outbox events.
 *
 * Everything lives in the SLF4J MDC of the handling thread: the correlation
 * id (from {@value #CORRELATION_ID_HEADER} or generated), the company from the
 * request path, and the invoice, bill, payment or journal entry being written.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String COMPANY_ID_MDC_KEY = "companyId";
    public static final String DOCUMENT_ID_MDC_KEY = "documentId";

    // stored in outbox_events.correlation_id
    static final int MAX_CORRELATION_ID_LENGTH = 100;
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._:-]+");

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Opens the context for a request. A client id that is blank, too long or
     * contains anything but letters, digits and {@code . _ : -} is replaced.
     *
     * @return the correlation id in effect
     */
    public static String begin(String requestedCorrelationId, String companyId) {
        String correlationId = isUsable(requestedCorrelationId)
                ? requestedCorrelationId
                : generateCorrelationId();
        MDC.put(CORRELATION_ID_MDC_KEY, correlationId);
        if (companyId != null) {
            MDC.put(COMPANY_ID_MDC_KEY, companyId);
        }
        return correlationId;
    }

    /**
     * @return the current request's correlation id, or null outside a request
     */
    public static String currentCorrelationId() {
        return MDC.get(CORRELATION_ID_MDC_KEY);
    }

    public static void document(UUID documentId) {
        MDC.put(DOCUMENT_ID_MDC_KEY, documentId.toString());
    }

    public static void end() {
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(COMPANY_ID_MDC_KEY);
        MDC.remove(DOCUMENT_ID_MDC_KEY);
    }

    static boolean isUsable(String correlationId) {
        return correlationId != null
                && correlationId.length() <= MAX_CORRELATION_ID_LENGTH
                && SAFE_ID.matcher(correlationId).matches();
    }

    /**
     * Short form, easier to read in logs.
     */
    static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
