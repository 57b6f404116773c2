package com.luanvv.olx.contact;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.luanvv.olx.browser.BrowserSession;
import com.luanvv.olx.browser.SessionPool;
import com.luanvv.olx.core.Config;
import com.luanvv.olx.core.Pacer;
import com.luanvv.olx.core.ProgressListener;
import com.luanvv.olx.core.RateLimiter;
import com.luanvv.olx.model.ListingField;
import com.luanvv.olx.model.ListingRecord;
import com.luanvv.olx.model.SessionCookie;
import com.microsoft.playwright.Page;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ContactEnricherTest {

    @TempDir
    Path dir;

    private final Config config = new Config();
    private final List<String> messages = new CopyOnWriteArrayList<>();
    private final ProgressListener listener = ProgressListener.of(messages::add);
    private final List<Duration> pauses = new CopyOnWriteArrayList<>();
    private final AtomicInteger launched = new AtomicInteger();
    private final BrowserSession browser = mock(BrowserSession.class);
    private final Page page = mock(Page.class);
    private FakeOlxServer server;
    private CookieStore cookieStore;
    private SessionPool sessions;
    private ContactEnricher enricher;

    @BeforeEach
    void setUp() throws Exception {
        server = new FakeOlxServer();
        config.getSite().setBaseUrl(server.baseUrl());
        config.getSite().setCookieDomain("127.0.0.1");
        config.getRateLimit().setPermitsPerSecond(1000);
        config.getRateLimit().setBurst(1000);
        when(browser.getPage()).thenReturn(page);
        when(browser.cookies()).thenReturn(List.of(new SessionCookie("kc_access_token", "fresh", "127.0.0.1", "/")));

        cookieStore = new CookieStore(dir.resolve("olx_cookies.json"), Duration.ofDays(7), Clock.systemUTC());
        sessions = new SessionPool(headless -> {
            launched.incrementAndGet();
            return browser;
        });
        Pacer pacer = new Pacer(config.getPacing(), pauses::add);
        ContactApiClient client = new ContactApiClient(config,
            HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build(), new ObjectMapper());
        enricher = new ContactEnricher(config, client, cookieStore,
            new BrowserLogin(config, sessions, cookieStore, pacer, Clock.systemUTC()),
            sessions, new RateLimiter(config.getRateLimit()), pacer);
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void rejectedSessionIsRefreshedFromBrowserAndRetried() {
        server.script("1001", new FakeOlxServer.Reply(401, "{\"error\":\"unauthorized\"}"));
        ListingRecord record = record("https://www.olx.com.pk/item/honda-civic-iid-1001", "");

        ContactEnricher.Result result = enricher.enrichWithSummary(List.of(record), listener);

        assertThat(result.getSuccesses()).isEqualTo(1);
        assertThat(result.getFailures()).isZero();
        assertThat(record.getContact()).containsEntry("mobile", "03001001").containsEntry("name", "Seller 1001");
        assertThat(server.contactHits()).hasSize(2).allSatisfy(hit -> {
            assertThat(hit.getCookie()).isEqualTo("kc_access_token=fresh");
            assertThat(hit.getReferer()).isEqualTo("https://www.olx.com.pk/item/honda-civic-iid-1001");
        });
        assertThat(messages).contains(
            "Opening browser for login...",
            "Login detected! Saving cookies for next time...",
            "Session rejected (HTTP 401); refreshed cookies from browser",
            "Contact fetching complete. Success: 1, Failed: 0");
        assertThat(pauses).contains(Duration.ofMillis(1200));
        assertThat(cookieStore.load()).isPresent();
        assertThat(launched).hasValue(1);
        verify(browser, atLeastOnce()).close();
        assertThat(sessions.activeCount()).isZero();
    }

    @Test
    void savedSessionSkipsTheBrowser() throws Exception {
        cookieStore.save(List.of(new SessionCookie("kc_access_token", "saved", "127.0.0.1", "/")));
        server.acceptSessionsWhere(cookie -> cookie.contains("kc_access_token=saved"));
        server.script("2002", new FakeOlxServer.Reply(304, null));
        ListingRecord first = record("https://www.olx.com.pk/item/a-iid-2001", "");
        ListingRecord second = record("https://www.olx.com.pk/item/b-iid-9999", "2002");

        ContactEnricher.Result result = enricher.enrichWithSummary(List.of(first, second), listener);

        assertThat(result.getSuccesses()).isEqualTo(2);
        assertThat(first.getContact()).containsEntry("mobile", "03002001");
        assertThat(second.getContact()).isEmpty();
        assertThat(server.contactHits()).extracting(FakeOlxServer.Hit::getPath)
            .containsExactly("/api/listing/2001/contactInfo/", "/api/listing/2002/contactInfo/");
        assertThat(messages).contains("Using saved login session (no login needed)");
        assertThat(launched).hasValue(0);
    }

    @Test
    void rejectedSavedSessionDeletesCookieFile() throws Exception {
        cookieStore.save(List.of(new SessionCookie("kc_access_token", "saved", "127.0.0.1", "/")));
        FakeOlxServer.Reply forbidden = new FakeOlxServer.Reply(403, "{}");
        server.script("3003", forbidden, forbidden, forbidden);

        ContactEnricher.Result result = enricher.enrichWithSummary(
            List.of(record("https://www.olx.com.pk/item/c-iid-3003", "")), listener);

        assertThat(result.getFailures()).isEqualTo(1);
        assertThat(server.contactHits()).hasSize(3);
        assertThat(cookieStore.getFile()).doesNotExist();
        assertThat(messages).contains("Failed for ad 3003: HTTP 403 for ad 3003");
        assertThat(pauses).contains(Duration.ofMillis(1200), Duration.ofMillis(2400));
        assertThat(launched).hasValue(0);
    }

    @Test
    void rateLimitedRequestPausesBeforeRetrying() throws Exception {
        cookieStore.save(List.of(new SessionCookie("kc_access_token", "saved", "127.0.0.1", "/")));
        server.script("4004", new FakeOlxServer.Reply(429, "{}"));

        ContactEnricher.Result result = enricher.enrichWithSummary(
            List.of(record("https://www.olx.com.pk/item/d-iid-4004", "")), listener);

        assertThat(result.getSuccesses()).isEqualTo(1);
        assertThat(pauses).contains(Duration.ofSeconds(5));
        assertThat(messages).contains("Rate limited at ad 1. Pausing...");
    }

    @Test
    void duplicateAdsAreFetchedOnce() throws Exception {
        cookieStore.save(List.of(new SessionCookie("kc_access_token", "saved", "127.0.0.1", "/")));
        ListingRecord a = record("https://www.olx.com.pk/item/e-iid-5005", "");
        ListingRecord b = record("https://www.olx.com.pk/item/e-again-iid-5005", "");

        enricher.enrich(List.of(a, b), listener);

        assertThat(server.contactHits()).hasSize(1);
        assertThat(a.getContact()).containsEntry("mobile", "03005005");
        assertThat(b.getContact()).containsEntry("mobile", "03005005");
    }

    @Test
    void recordsWithoutAdIdAreLeftAlone() {
        ListingRecord record = record("https://www.olx.com.pk/cars_c84", "");

        List<ListingRecord> out = enricher.enrich(List.of(record), listener);

        assertThat(out).containsExactly(record);
        assertThat(server.hits()).isEmpty();
        assertThat(messages).contains("No Ad IDs found in listings; skipping contact fetch.");
    }

    @Test
    void missingLoginTimesOutAndClosesTheBrowser() {
        config.getTimeouts().setLoginTimeoutMs(0);
        when(browser.cookies()).thenReturn(List.of(new SessionCookie("_ga", "GA1", "127.0.0.1", "/")));

        assertThatThrownBy(() -> enricher.enrich(
            List.of(record("https://www.olx.com.pk/item/f-iid-6006", "")), listener))
            .isInstanceOf(LoginTimeoutException.class);
        assertThat(server.contactHits()).isEmpty();
        assertThat(sessions.activeCount()).isZero();
        verify(browser, atLeastOnce()).close();
    }

    private static ListingRecord record(String link, String adId) {
        Map<ListingField, String> fields = new EnumMap<>(ListingField.class);
        fields.put(ListingField.LINK, link);
        fields.put(ListingField.AD_ID, adId);
        fields.put(ListingField.TITLE, "Car");
        return new ListingRecord("lahore", "Lahore", fields, List.of(), Map.of(), null);
    }
}
