package de.htwsaar.modelcache.common.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet-Filter zur Korrelation von Cache-Requests über eine Trace-ID.
 *
 * <p>Die Trace-ID wird aus dem Header {@value #TRACE_ID_HEADER} übernommen oder neu erzeugt,
 * im MDC abgelegt (damit jede Logzeile des Requests sie trägt) und in der Antwort
 * zurückgegeben.</p>
 */
public class TraceIdFilter extends OncePerRequestFilter {

    /** Schlüsselname der Trace-ID im Logging-Kontext */
    public static final String TRACE_ID_KEY = "traceId";

    /** HTTP-Header für eingehende und ausgehende Trace-IDs */
    public static final String TRACE_ID_HEADER = "X-Trace-Id";

    /** Obergrenze für übernommene IDs, längere Header werden ersetzt */
    static final int MAX_TRACE_ID_LENGTH = 128;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String traceId = resolveTraceId(request.getHeader(TRACE_ID_HEADER));
        MDC.put(TRACE_ID_KEY, traceId);
        response.setHeader(TRACE_ID_HEADER, traceId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }

    static String resolveTraceId(String incoming) {
        if (incoming == null) return UUID.randomUUID().toString();
        String trimmed = incoming.trim();
        if (trimmed.isEmpty() || trimmed.length() > MAX_TRACE_ID_LENGTH) {
            return UUID.randomUUID().toString();
        }
        return trimmed;
    }
}
