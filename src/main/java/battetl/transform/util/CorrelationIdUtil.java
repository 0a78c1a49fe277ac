package battetl.transform.util;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Correlation id held in the SLF4J MDC.
 *
 * Set by CorrelationIdFilter for HTTP requests. Batch callers running a
 * transform outside a request can use {@link #startRun()} and
 * {@link #clearCorrelationId()} so log lines of one run stay grouped.
 */
public final class CorrelationIdUtil {

    public static final String CORRELATION_ID_KEY = "correlationId";

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    static final String NO_CORRELATION_ID = "NO-CORRELATION-ID";

    private CorrelationIdUtil() {
    }

    /**
     * @return the current correlation id, or {@code NO-CORRELATION-ID} when unset
     */
    public static String getCurrentCorrelationId() {
        String correlationId = MDC.get(CORRELATION_ID_KEY);
        return correlationId != null ? correlationId : NO_CORRELATION_ID;
    }

    public static void setCorrelationId(String correlationId) {
        MDC.put(CORRELATION_ID_KEY, correlationId);
    }

    /**
     * Use the given id, or a new random one when it is null or blank.
     *
     * @return the id now in the MDC
     */
    public static String setOrGenerate(String candidate) {
        String correlationId = candidate == null || candidate.trim().isEmpty()
                ? UUID.randomUUID().toString()
                : candidate.trim();
        setCorrelationId(correlationId);
        return correlationId;
    }

    /**
     * Start a new run with a fresh id.
     */
    public static String startRun() {
        return setOrGenerate(null);
    }

    /**
     * Always call from a finally block; MDC values outlive the request on pooled threads.
     */
    public static void clearCorrelationId() {
        MDC.remove(CORRELATION_ID_KEY);
    }

    public static boolean hasCorrelationId() {
        return MDC.get(CORRELATION_ID_KEY) != null;
    }
}
