package com.docsage.api.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.web.servlet.AsyncHandlerInterceptor;

import java.util.UUID;

/**
 * Puts request correlation keys into the MDC. Long polls are dispatched twice
 * (start and async completion), so the request id is kept as a request
 * attribute and reused on the second dispatch.
 */
public class RequestMdcInterceptor implements AsyncHandlerInterceptor {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    static final String REQUEST_ID_KEY = "request_id";
    static final String METHOD_KEY = "http_method";
    static final String PATH_KEY = "http_path";

    private static final String REQUEST_ID_ATTRIBUTE = RequestMdcInterceptor.class.getName() + ".REQUEST_ID";

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String requestId = resolveRequestId(request);
        request.setAttribute(REQUEST_ID_ATTRIBUTE, requestId);
        response.setHeader(REQUEST_ID_HEADER, requestId);

        MDC.put(REQUEST_ID_KEY, requestId);
        MDC.put(METHOD_KEY, request.getMethod());
        MDC.put(PATH_KEY, request.getRequestURI());
        return true;
    }

    @Override
    public void afterConcurrentHandlingStarted(HttpServletRequest request, HttpServletResponse response, Object handler) {
        clear();
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler,
                                @Nullable Exception ex) {
        clear();
    }

    private String resolveRequestId(HttpServletRequest request) {
        Object existing = request.getAttribute(REQUEST_ID_ATTRIBUTE);
        if (existing instanceof String requestId) {
            return requestId;
        }
        String header = request.getHeader(REQUEST_ID_HEADER);
        if (header != null && !header.isBlank()) {
            return header.trim();
        }
        return UUID.randomUUID().toString();
    }

    private void clear() {
        MDC.remove(REQUEST_ID_KEY);
        MDC.remove(METHOD_KEY);
        MDC.remove(PATH_KEY);
    }
}
