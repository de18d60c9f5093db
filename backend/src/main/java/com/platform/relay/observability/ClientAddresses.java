package com.platform.relay.observability;

import jakarta.servlet.http.HttpServletRequest;

public final class ClientAddresses {

    private ClientAddresses() {
    }

    /**
     * First X-Forwarded-For hop, or the socket peer address.
     */
    public static String of(HttpServletRequest request) {
        String xForwardedFor = request.getHeader("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isEmpty()) {
            return xForwardedFor.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
