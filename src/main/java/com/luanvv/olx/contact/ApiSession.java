package com.luanvv.olx.contact;

import com.luanvv.olx.model.SessionCookie;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

public class ApiSession {
    private final HttpClient http;
    private final List<SessionCookie> cookies;
    private final Map<String, String> headers;
    private final String defaultDomain;

    ApiSession(HttpClient http, List<SessionCookie> cookies, Map<String, String> headers, String defaultDomain) {
        this.http = http;
        this.cookies = List.copyOf(cookies);
        this.headers = new LinkedHashMap<>(headers);
        this.defaultDomain = defaultDomain;
    }

    public HttpResponse<String> get(URI uri, Map<String, String> extraHeaders, Duration timeout)
            throws IOException, InterruptedException {
        HttpRequest.Builder request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .GET();
        headers.forEach(request::header);
        extraHeaders.forEach(request::header);
        String cookieHeader = cookieHeader(uri);
        if (!cookieHeader.isEmpty()) {
            request.header("Cookie", cookieHeader);
        }
        return http.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    String cookieHeader(URI uri) {
        String host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
        String path = uri.getPath() == null || uri.getPath().isEmpty() ? "/" : uri.getPath();
        return cookies.stream()
                .filter(SessionCookie::hasValue)
                .filter(c -> domainMatches(c.getDomain() != null ? c.getDomain() : defaultDomain, host))
                .filter(c -> c.getPath() == null || path.startsWith(c.getPath()))
                .map(c -> c.getName() + "=" + c.getValue())
                .collect(Collectors.joining("; "));
    }

    static boolean domainMatches(String cookieDomain, String host) {
        if (cookieDomain == null || cookieDomain.isBlank()) {
            return false;
        }
        String domain = cookieDomain.toLowerCase(Locale.ROOT);
        if (domain.startsWith(".")) {
            domain = domain.substring(1);
        }
        return host.equals(domain) || host.endsWith("." + domain);
    }
}
