package com.phillippitts.speakstream.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MdcFilterTest {

    private MdcFilter filter;
    private HttpServletRequest request;
    private HttpServletResponse response;
    private FilterChain chain;

    @BeforeEach
    void setUp() {
        filter = new MdcFilter();
        request = mock(HttpServletRequest.class);
        response = mock(HttpServletResponse.class);
        chain = mock(FilterChain.class);
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/api/session/start");
        ThreadContext.clearAll();
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void shouldPopulateContextDuringChain() throws Exception {
        when(request.getHeader(MdcFilter.REQUEST_ID_HEADER)).thenReturn("req-42");
        when(request.getHeader(MdcFilter.USER_ID_HEADER)).thenReturn("alice");
        Map<String, String> seen = new HashMap<>();
        doAnswer(inv -> {
            seen.putAll(ThreadContext.getImmutableContext());
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);

        assertThat(seen)
                .containsEntry("requestId", "req-42")
                .containsEntry("userId", "alice")
                .containsEntry("method", "POST")
                .containsEntry("uri", "/api/session/start");
        verify(response).setHeader(MdcFilter.REQUEST_ID_HEADER, "req-42");
    }

    @Test
    void shouldGenerateRequestIdWhenHeaderMissing() throws Exception {
        Map<String, String> seen = new HashMap<>();
        doAnswer(inv -> {
            seen.putAll(ThreadContext.getImmutableContext());
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);

        assertThat(seen.get("requestId")).isNotBlank();
        assertThat(seen).doesNotContainKey("userId");
        verify(response).setHeader(eq(MdcFilter.REQUEST_ID_HEADER), anyString());
    }

    @Test
    void removesOwnKeysButKeepsSessionId() throws Exception {
        ThreadContext.put("sessionId", "s-1");

        filter.doFilter(request, response, chain);

        assertThat(ThreadContext.get("requestId")).isNull();
        assertThat(ThreadContext.get("method")).isNull();
        assertThat(ThreadContext.get("uri")).isNull();
        assertThat(ThreadContext.get("sessionId")).isEqualTo("s-1");
    }

    @Test
    void clearsKeysWhenChainThrows() throws Exception {
        doAnswer(inv -> {
            throw new IllegalStateException("boom");
        }).when(chain).doFilter(any(), any());

        try {
            filter.doFilter(request, response, chain);
        } catch (IllegalStateException expected) {
            assertThat(expected).hasMessage("boom");
        }

        assertThat(ThreadContext.get("requestId")).isNull();
    }
}
