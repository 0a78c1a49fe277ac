package battetl.transform.config;

import battetl.transform.util.CorrelationIdUtil;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Puts a correlation id in the MDC for every request.
 *
 * The id comes from the X-Correlation-ID request header when present and is
 * generated otherwise. It is echoed in the response header and printed by the
 * console log pattern.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@Slf4j
public class CorrelationIdFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {

        String correlationId = CorrelationIdUtil.setOrGenerate(
                request.getHeader(CorrelationIdUtil.CORRELATION_ID_HEADER));
        response.setHeader(CorrelationIdUtil.CORRELATION_ID_HEADER, correlationId);

        long startTime = System.currentTimeMillis();
        try {
            log.info("Request started: {} {}", request.getMethod(), request.getRequestURI());
            chain.doFilter(request, response);
            log.info("Request completed: {} {} | Status: {} | Duration: {}ms",
                    request.getMethod(), request.getRequestURI(), response.getStatus(),
                    System.currentTimeMillis() - startTime);
        } catch (IOException | ServletException | RuntimeException e) {
            log.error("Request failed: {} {}", request.getMethod(), request.getRequestURI(), e);
            throw e;
        } finally {
            CorrelationIdUtil.clearCorrelationId();
        }
    }
}
