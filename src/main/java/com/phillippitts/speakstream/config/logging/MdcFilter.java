package com.phillippitts.speakstream.config.logging;

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
import java.util.List;
import java.util.UUID;

/**
 * Puts requestId, userId, method and uri of local control API calls into the Log4j2
 * ThreadContext and echoes the request id back in {@code X-Request-ID}.
 *
 * <p>Only the keys set here are removed afterwards; a sessionId put by the session layer on the
 * same thread is left alone until the session code removes it.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String USER_ID_HEADER = "X-User-ID";
    private static final List<String> KEYS = List.of("requestId", "userId", "method", "uri");

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                String requestId = headerOrGenerate(http, REQUEST_ID_HEADER);
                ThreadContext.put("requestId", requestId);
                if (response instanceof HttpServletResponse httpResponse) {
                    httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
                }

                String userId = http.getHeader(USER_ID_HEADER);
                if (userId != null && !userId.isBlank()) {
                    ThreadContext.put("userId", userId);
                }

                ThreadContext.put("method", http.getMethod());
                ThreadContext.put("uri", http.getRequestURI());
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.removeAll(KEYS);
        }
    }

    private static String headerOrGenerate(HttpServletRequest req, String headerName) {
        String v = req.getHeader(headerName);
        return (v == null || v.isBlank()) ? UUID.randomUUID().toString() : v;
    }
}
