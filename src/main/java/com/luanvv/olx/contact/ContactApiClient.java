package com.luanvv.olx.contact;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.luanvv.olx.core.Config;
import com.luanvv.olx.core.CrawlerException;
import com.luanvv.olx.model.SessionCookie;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Calls the site's JSON endpoints: the logged-in user probe and the per-listing contact
 * endpoint.
 */
@Slf4j
public class ContactApiClient {
    private static final TypeReference<Map<String, Object>> PAYLOAD = new TypeReference<>() { };

    private final Config config;
    private final HttpClient http;
    private final ObjectMapper mapper;

    public ContactApiClient(Config config, ObjectMapper mapper) {
        this(config, HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(config.getTimeouts().getRequestTimeoutMs()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), mapper);
    }

    public ContactApiClient(Config config, HttpClient http, ObjectMapper mapper) {
        this.config = config;
        this.http = http;
        this.mapper = mapper;
    }

    /** Opens a session sending the given cookies and the configured browser identity. */
    public ApiSession open(List<SessionCookie> cookies) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("User-Agent", config.getBrowser().getUserAgent());
        headers.put("Accept", "application/json, text/plain, */*");
        headers.put("Accept-Language", config.getBrowser().getLocale() + ",en;q=0.9");
        headers.put("X-Requested-With", "XMLHttpRequest");
        return new ApiSession(http, cookies, headers, config.getSite().getCookieDomain());
    }

    /**
     * True when the session is recognised as logged in. Transport failures count as not
     * logged in.
     */
    public boolean probe(ApiSession session) {
        URI uri = resolve(config.getSite().getProbePath());
        try {
            HttpResponse<String> response = session.get(uri,
                    Map.of("Referer", config.getSite().homeUrl()),
                    Duration.ofMillis(config.getTimeouts().getProbeTimeoutMs()));
            log.debug("Probe {} returned HTTP {}", uri, response.statusCode());
            return response.statusCode() == 200 || response.statusCode() == 304;
        } catch (IOException e) {
            log.warn("Session probe failed: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CrawlerException("Interrupted during session probe", e);
        }
    }

    /**
     * Fetches the contact payload of one ad. A 304 answer yields an empty payload.
     *
     * @throws ContactFetchException on any other status, an unparseable body or a transport failure
     */
    public Map<String, Object> fetchContact(ApiSession session, String adId, String referer) {
        URI uri = resolve(config.getSite().getContactPath().replace("{adId}", adId));
        HttpResponse<String> response;
        try {
            response = session.get(uri, Map.of("Referer", referer),
                    Duration.ofMillis(config.getTimeouts().getRequestTimeoutMs()));
        } catch (IOException e) {
            throw new ContactFetchException("Request for ad " + adId + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CrawlerException("Interrupted while fetching contact of ad " + adId, e);
        }
        int status = response.statusCode();
        if (status == 304) {
            return Map.of();
        }
        if (status != 200) {
            throw new ContactFetchException(status, "HTTP " + status + " for ad " + adId);
        }
        try {
            Map<String, Object> payload = mapper.readValue(response.body(), PAYLOAD);
            return payload == null ? Map.of() : payload;
        } catch (IOException e) {
            throw new ContactFetchException(status, "Unreadable contact payload for ad " + adId + ": " + e.getMessage());
        }
    }

    /** Listing page URL used as referer when a record carries no link. */
    public String listingUrl(String adId) {
        return config.getSite().homeUrl() + "item/iid-" + adId;
    }

    private URI resolve(String path) {
        String base = config.getSite().getBaseUrl();
        if (base.endsWith("/") && path.startsWith("/")) {
            path = path.substring(1);
        }
        return URI.create(base + path);
    }
}
