package com.luanvv.olx.contact;

import com.luanvv.olx.browser.BrowserSession;
import com.luanvv.olx.browser.SessionPool;
import com.luanvv.olx.core.Config;
import com.luanvv.olx.core.Pacer;
import com.luanvv.olx.core.Progress;
import com.luanvv.olx.core.ProgressListener;
import com.luanvv.olx.core.RateLimiter;
import com.luanvv.olx.model.ListingRecord;
import com.luanvv.olx.model.SessionCookie;
import com.microsoft.playwright.PlaywrightException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Adds seller contact data to crawled listings through the authenticated contact API.
 * Reuses saved cookies when the site still accepts them, otherwise falls back to an
 * interactive browser login.
 */
@Slf4j
@RequiredArgsConstructor
public class ContactEnricher {
    private static final int PROGRESS_EVERY = 10;
    private static final int REPORTED_FAILURES = 3;

    private final Config config;
    private final ContactApiClient client;
    private final CookieStore cookieStore;
    private final BrowserLogin login;
    private final SessionPool sessions;
    private final RateLimiter limiter;
    private final Pacer pacer;

    @Value
    public static class Result {
        List<ListingRecord> records;
        int successes;
        int failures;
    }

    /**
     * Enriches the records in place and returns them.
     *
     * @throws LoginTimeoutException when a login was needed and did not happen in time
     */
    public List<ListingRecord> enrich(List<ListingRecord> records, ProgressListener listener) {
        return enrichWithSummary(records, listener).getRecords();
    }

    public Result enrichWithSummary(List<ListingRecord> records, ProgressListener listener) {
        Progress progress = new Progress(listener);
        Map<String, List<ListingRecord>> byAdId = new LinkedHashMap<>();
        for (ListingRecord record : records) {
            AdIds.resolve(record).ifPresent(id -> byAdId.computeIfAbsent(id, k -> new ArrayList<>()).add(record));
        }
        if (byAdId.isEmpty()) {
            progress.report("No Ad IDs found in listings; skipping contact fetch.");
            return new Result(records, 0, 0);
        }
        progress.report("Found %d ads to fetch contacts for", byAdId.size());

        Run run = new Run(progress);
        try {
            run.start();
            run.fetchAll(byAdId);
        } finally {
            if (run.browser != null) {
                sessions.release(run.browser);
            }
        }
        progress.report("Contact fetching complete. Success: %d, Failed: %d", run.successes, run.failures);
        return new Result(records, run.successes, run.failures);
    }

    private class Run {
        private final Progress progress;
        private final Set<String> excluded = new HashSet<>(config.getOutput().getExcludedFields());
        private BrowserSession browser;
        private ApiSession api;
        private boolean savedSessionDropped;
        private int successes;
        private int failures;

        Run(Progress progress) {
            this.progress = progress;
        }

        void start() {
            Optional<ApiSession> saved = fromSavedCookies();
            if (saved.isPresent()) {
                api = saved.get();
                return;
            }
            progress.report("Opening browser for login...");
            browser = login.login(progress);
            progress.report("Preparing API session...");
            api = client.open(browser.cookies());
            login.lightBrowsing(browser);
        }

        private Optional<ApiSession> fromSavedCookies() {
            Optional<CookieSession> saved = cookieStore.load();
            if (saved.isEmpty()) {
                return Optional.empty();
            }
            if (!saved.get().hasAuthCookie(config.getCookies().getAuthCookieNames())) {
                progress.report("Saved cookies carry no login token, need fresh login...");
                return Optional.empty();
            }
            ApiSession session = client.open(saved.get().getCookies());
            limiter.acquire();
            if (client.probe(session)) {
                progress.report("Using saved login session (no login needed)");
                return Optional.of(session);
            }
            progress.report("Saved session expired, need fresh login...");
            return Optional.empty();
        }

        void fetchAll(Map<String, List<ListingRecord>> byAdId) {
            int total = byAdId.size();
            int position = 0;
            int nextBrowse = pacer.nextBrowsingInterval();
            for (Map.Entry<String, List<ListingRecord>> entry : byAdId.entrySet()) {
                position++;
                String adId = entry.getKey();
                List<ListingRecord> targets = entry.getValue();
                String referer = targets.get(0).getLink().isBlank()
                        ? client.listingUrl(adId)
                        : targets.get(0).getLink();

                Optional<Map<String, Object>> payload = fetchWithRetry(adId, referer, position);
                if (payload.isPresent()) {
                    successes++;
                    for (ListingRecord record : targets) {
                        record.mergeContact(payload.get(), excluded);
                    }
                } else {
                    failures++;
                }

                if (position % PROGRESS_EVERY == 0) {
                    progress.report("Fetched contacts: %d/%d (%d success, %d failed)", position, total, successes, failures);
                }
                if (position < total) {
                    pacer.afterRequest(position);
                    if (browser != null && position >= nextBrowse) {
                        login.lightBrowsing(browser);
                        nextBrowse = position + pacer.nextBrowsingInterval();
                    }
                }
            }
        }

        private Optional<Map<String, Object>> fetchWithRetry(String adId, String referer, int position) {
            int attempts = Math.max(1, config.getRetries().getContactAttempts());
            ContactFetchException last = null;
            for (int attempt = 1; attempt <= attempts; attempt++) {
                limiter.acquire();
                try {
                    return Optional.of(client.fetchContact(api, adId, referer));
                } catch (ContactFetchException e) {
                    last = e;
                    log.debug("Contact fetch for ad {} failed on attempt {}/{}: {}", adId, attempt, attempts, e.getMessage());
                    if (e.isRateLimited()) {
                        progress.report("Rate limited at ad %d. Pausing...", position);
                        pacer.rateLimited();
                    } else if (e.isAuthFailure()) {
                        onAuthFailure(e.getStatus());
                    }
                }
                if (attempt < attempts) {
                    pacer.sleeper().pause(Duration.ofMillis(config.getRetries().getContactBackoffMs() * attempt));
                }
            }
            if (failures < REPORTED_FAILURES) {
                progress.report("Failed for ad %s: %s", adId, last.getMessage());
            } else {
                log.warn("Failed for ad {}: {}", adId, last.getMessage());
            }
            return Optional.empty();
        }

        private void onAuthFailure(int status) {
            if (browser != null) {
                try {
                    List<SessionCookie> cookies = browser.cookies();
                    api = client.open(cookies);
                    progress.report("Session rejected (HTTP %d); refreshed cookies from browser", status);
                } catch (PlaywrightException e) {
                    log.warn("Could not refresh cookies from browser: {}", e.getMessage());
                    progress.report("Session rejected (HTTP %d) and cookie refresh failed", status);
                }
            } else if (!savedSessionDropped) {
                savedSessionDropped = true;
                cookieStore.delete();
                progress.report("Saved session rejected (HTTP %d); cookie file deleted, log in again next run", status);
            }
        }
    }
}
