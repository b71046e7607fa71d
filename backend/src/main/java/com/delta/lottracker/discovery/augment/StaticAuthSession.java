package com.delta.lottracker.discovery.augment;

import java.util.LinkedHashMap;
import java.util.Map;

public class StaticAuthSession implements AuthSession {
    private final String cookie;
    private final String bearerToken;

    public StaticAuthSession(String cookie, String bearerToken) {
        this.cookie = blankToNull(cookie);
        this.bearerToken = blankToNull(bearerToken);
    }

    @Override
    public boolean isValid() {
        return cookie != null || bearerToken != null;
    }

    // Configured credentials cannot be refreshed from here.
    @Override
    public boolean renew() {
        return false;
    }

    @Override
    public Map<String, String> headers() {
        Map<String, String> headers = new LinkedHashMap<>();
        if (cookie != null) {
            headers.put("Cookie", cookie);
        }
        if (bearerToken != null) {
            headers.put("Authorization", "Bearer " + bearerToken);
        }
        return headers;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
