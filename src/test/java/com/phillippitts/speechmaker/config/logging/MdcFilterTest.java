package com.phillippitts.speechmaker.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.matches;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MdcFilterTest {

    private static final String UUID_PATTERN = "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}";

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
        ThreadContext.clearAll();
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void usesRequestIdHeaderAndEchoesIt() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn(" req-123 ");
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/api/conversions");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get("requestId")).isEqualTo("req-123");
            assertThat(ThreadContext.get("method")).isEqualTo("POST");
            assertThat(ThreadContext.get("uri")).isEqualTo("/api/conversions");
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);

        verify(response).setHeader("X-Request-ID", "req-123");
        assertThat(ThreadContext.get("requestId")).isNull();
    }

    @Test
    void generatesUuidWhenHeaderMissingOrBlank() throws ServletException, IOException {
        for (String header : new String[]{null, "   "}) {
            when(request.getHeader("X-Request-ID")).thenReturn(header);
            when(request.getMethod()).thenReturn("GET");
            when(request.getRequestURI()).thenReturn("/api/readiness");

            doAnswer(invocation -> {
                assertThat(ThreadContext.get("requestId")).matches(UUID_PATTERN);
                return null;
            }).when(chain).doFilter(any(), any());

            filter.doFilter(request, response, chain);
        }
        verify(response, times(2)).setHeader(eq("X-Request-ID"), matches(UUID_PATTERN));
    }

    @Test
    void clearsContextEvenWhenChainThrows() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("req-123");
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/api/conversions");
        doThrow(new ServletException("boom")).when(chain).doFilter(request, response);

        assertThatThrownBy(() -> filter.doFilter(request, response, chain))
                .isInstanceOf(ServletException.class)
                .hasMessage("boom");

        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void leavesNonHttpRequestsUntouched() throws ServletException, IOException {
        ServletRequest plain = mock(ServletRequest.class);

        filter.doFilter(plain, response, chain);

        verify(chain).doFilter(plain, response);
        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void doesNotLeakBetweenRequests() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("req-1");
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/api/first");
        filter.doFilter(request, response, chain);

        when(request.getHeader("X-Request-ID")).thenReturn("req-2");
        when(request.getRequestURI()).thenReturn("/api/second");
        doAnswer(invocation -> {
            assertThat(ThreadContext.get("requestId")).isEqualTo("req-2");
            assertThat(ThreadContext.get("uri")).isEqualTo("/api/second");
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);
    }
}
