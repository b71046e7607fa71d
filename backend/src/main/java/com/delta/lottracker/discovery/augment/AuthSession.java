package com.delta.lottracker.discovery.augment;

import java.util.Map;

/**
 * Credentials for the rendered channel, produced outside this service (browser login, token
 * capture). Consumers only read it; {@link #renew()} is the single hook for refreshing it.
 */
public interface AuthSession {
    boolean isValid();

    /**
     * @return true when the session was refreshed and may be used again
     */
    boolean renew();

    /**
     * Request headers that carry the credentials, e.g. {@code Cookie} or {@code Authorization}.
     */
    Map<String, String> headers();
}
