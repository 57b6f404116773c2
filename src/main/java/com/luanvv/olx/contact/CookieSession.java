package com.luanvv.olx.contact;

import com.luanvv.olx.model.SessionCookie;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import lombok.Value;

@Value
public class CookieSession {
    List<SessionCookie> cookies;
    Instant savedAt;

    public boolean isExpired(Instant now, Duration ttl) {
        return Duration.between(savedAt, now).compareTo(ttl) > 0;
    }

    public boolean hasAuthCookie(Collection<String> authCookieNames) {
        return hasAuthCookie(cookies, authCookieNames);
    }

    public static boolean hasAuthCookie(Collection<SessionCookie> cookies, Collection<String> authCookieNames) {
        return cookies.stream()
            .anyMatch(c -> c.hasValue() && authCookieNames.contains(c.getName()));
    }
}
