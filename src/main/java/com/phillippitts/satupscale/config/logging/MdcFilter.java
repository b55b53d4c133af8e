package com.phillippitts.satupscale.config.logging;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Puts the request id, and the job id for requests addressed to a single job, into Log4j2's
 * ThreadContext.
 *
 * <p>The request id comes from the X-Request-ID header, or is generated, and is echoed on the
 * response. Requests under {@code /api/jobs/{jobId}} carry {@code jobId}, the same key the queue
 * worker sets while the job runs, so status polls and cancels line up with the job's own log
 * lines. Jobs submitted during the request inherit the context on the worker. The context is
 * always cleared after the request.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";

    private static final Pattern JOB_PATH = Pattern.compile("^/api/jobs/([^/]+)(?:/.*)?$");

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                String requestId = Optional.ofNullable(http.getHeader(REQUEST_ID_HEADER))
                        .filter(v -> !v.isBlank())
                        .orElseGet(() -> UUID.randomUUID().toString());
                ThreadContext.put(LogContextKeys.REQUEST_ID, requestId);
                ThreadContext.put(LogContextKeys.METHOD, http.getMethod());
                ThreadContext.put(LogContextKeys.URI, http.getRequestURI());
                jobIdFromPath(http.getRequestURI()).ifPresent(id -> ThreadContext.put(LogContextKeys.JOB_ID, id));
                if (response instanceof HttpServletResponse httpResponse) {
                    httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
                }
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    static Optional<String> jobIdFromPath(String uri) {
        if (uri == null) {
            return Optional.empty();
        }
        Matcher m = JOB_PATH.matcher(uri);
        return m.matches() ? Optional.of(m.group(1)) : Optional.empty();
    }
}
