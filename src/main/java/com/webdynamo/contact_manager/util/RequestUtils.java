package com.webdynamo.contact_manager.util;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.util.StringUtils;

import java.util.Collection;

public final class RequestUtils {

    private static final String[] PROXY_HEADERS = {"X-Forwarded-For", "X-Real-IP"};

    private RequestUtils() {
    }

    /**
     * Client address for per-IP rate limiting.
     * Proxy headers are only read when the request arrives from one of the trusted proxies;
     * then the first hop of X-Forwarded-For wins, then X-Real-IP. Otherwise the socket address is used.
     */
    public static String getClientIP(HttpServletRequest request, Collection<String> trustedProxies) {
        String remoteAddr = request.getRemoteAddr();
        if (trustedProxies == null || !trustedProxies.contains(remoteAddr)) {
            return remoteAddr;
        }
        for (String header : PROXY_HEADERS) {
            String value = request.getHeader(header);
            if (StringUtils.hasText(value)) {
                return value.split(",", 2)[0].trim();
            }
        }
        return remoteAddr;
    }
}
