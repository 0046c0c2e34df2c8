package com.example.ratecontrol.identity;

import jakarta.servlet.http.HttpServletRequest;

/**
 * {@link ClientRequest} view over a servlet request.
 */
public final class ServletClientRequest implements ClientRequest {

    private final HttpServletRequest request;

    private ServletClientRequest(HttpServletRequest request) {
        this.request = request;
    }

    public static ServletClientRequest of(HttpServletRequest request) {
        return new ServletClientRequest(request);
    }

    @Override
    public String header(String name) {
        return request.getHeader(name);
    }

    @Override
    public String path() {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            return uri.substring(contextPath.length());
        }
        return uri;
    }

    @Override
    public String method() {
        return request.getMethod();
    }
}
