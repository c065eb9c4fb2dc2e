package com.taskmesh.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * HTTP 链路日志过滤器。
 * <p>
 * traceId/requestId 写入 MDC 与响应头；会话接口额外把路径中的 sessionId 写入 MDC，
 * 同一请求内的计划存储与执行日志可以按会话检索。超过阈值的请求以 info 级别输出。
 * </p>
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RequestTraceLoggingFilter extends OncePerRequestFilter {

    private static final String HEADER_TRACE_ID = "X-Trace-Id";
    private static final String HEADER_REQUEST_ID = "X-Request-Id";
    private static final Pattern SESSION_PATH = Pattern.compile("^/api/sessions/([^/]+)");

    private final long slowRequestThresholdMs;

    public RequestTraceLoggingFilter(@Value("${observability.http-log.slow-request-threshold-ms:1000}") long slowRequestThresholdMs) {
        this.slowRequestThresholdMs = slowRequestThresholdMs;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path == null || !path.startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String traceId = headerOrRandom(request, HEADER_TRACE_ID);
        String requestId = headerOrRandom(request, HEADER_REQUEST_ID);
        String path = request.getRequestURI();
        String sessionId = sessionIdOf(path);
        response.setHeader(HEADER_TRACE_ID, traceId);
        response.setHeader(HEADER_REQUEST_ID, requestId);

        try (MDC.MDCCloseable ignoredTrace = MDC.putCloseable("traceId", traceId);
             MDC.MDCCloseable ignoredRequest = MDC.putCloseable("requestId", requestId);
             MDC.MDCCloseable ignoredSession = MDC.putCloseable("sessionId", sessionId)) {
            long startNs = System.nanoTime();
            try {
                filterChain.doFilter(request, response);
            } finally {
                logExit(request.getMethod(), path, response.getStatus(), (System.nanoTime() - startNs) / 1_000_000L);
            }
        }
    }

    private void logExit(String method, String path, int status, long costMs) {
        if (costMs >= slowRequestThresholdMs) {
            log.info("HTTP_SLOW method={}, path={}, status={}, costMs={}", method, path, status, costMs);
        } else {
            log.debug("HTTP_OUT method={}, path={}, status={}, costMs={}", method, path, status, costMs);
        }
    }

    private String sessionIdOf(String path) {
        Matcher matcher = SESSION_PATH.matcher(StringUtils.defaultString(path));
        return matcher.find() ? matcher.group(1) : "-";
    }

    private String headerOrRandom(HttpServletRequest request, String header) {
        String value = request.getHeader(header);
        return StringUtils.isNotBlank(value) ? value.trim() : UUID.randomUUID().toString().replace("-", "");
    }
}
