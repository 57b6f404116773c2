package com.luanvv.olx.contact;

import com.luanvv.olx.browser.BrowserSession;
import com.luanvv.olx.browser.SessionPool;
import com.luanvv.olx.core.Config;
import com.luanvv.olx.core.Pacer;
import com.luanvv.olx.core.Progress;
import com.luanvv.olx.model.SessionCookie;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Interactive login: opens a visible browser on the home page and waits for the user to
 * sign in, detected by the appearance of an authentication cookie.
 */
@Slf4j
@RequiredArgsConstructor
public class BrowserLogin {
    private static final long REMINDER_EVERY_SECONDS = 30;

    private final Config config;
    private final SessionPool sessions;
    private final CookieStore cookieStore;
    private final Pacer pacer;
    private final Clock clock;

    /**
     * Opens a visible session and blocks until the user is logged in. The returned session
     * belongs to the caller.
     *
     * @throws LoginTimeoutException when no login happened within the configured time
     */
    public BrowserSession login(Progress progress) {
        BrowserSession session = sessions.create(false);
        try {
            awaitLogin(session, progress);
            return session;
        } catch (RuntimeException e) {
            sessions.release(session);
            throw e;
        }
    }

    void awaitLogin(BrowserSession session, Progress progress) {
        Duration timeout = Duration.ofMillis(config.getTimeouts().getLoginTimeoutMs());
        Instant start = clock.instant();
        openHome(session.getPage());
        progress.report("Please log in to OLX in the browser window (waiting up to %d s)...", timeout.toSeconds());
        long lastReminder = 0;
        while (true) {
            List<SessionCookie> cookies = readCookies(session);
            if (CookieSession.hasAuthCookie(cookies, config.getCookies().getAuthCookieNames())) {
                progress.report("Login detected! Saving cookies for next time...");
                persist(cookies, progress);
                return;
            }
            Duration elapsed = Duration.between(start, clock.instant());
            if (elapsed.compareTo(timeout) >= 0) {
                break;
            }
            long bucket = elapsed.toSeconds() / REMINDER_EVERY_SECONDS;
            if (bucket > lastReminder) {
                lastReminder = bucket;
                progress.report("Still waiting for login (%d s left)...", timeout.minus(elapsed).toSeconds());
            }
            lightBrowsing(session);
        }
        progress.report("Login not detected within %d s", timeout.toSeconds());
        throw new LoginTimeoutException("No login within " + timeout.toSeconds() + " s");
    }

    /**
     * Visits the home page and scrolls around a little. Failures are only logged; the
     * session keeps its state either way.
     */
    public void lightBrowsing(BrowserSession session) {
        try {
            openHome(session.getPage());
            pacer.between(800, 1500);
            int scrolls = ThreadLocalRandom.current().nextInt(1, 3);
            for (int i = 0; i < scrolls; i++) {
                session.scrollBy(ThreadLocalRandom.current().nextInt(100, 401));
                pacer.between(400, 800);
            }
            session.scrollToTop();
            pacer.between(300, 600);
        } catch (PlaywrightException e) {
            log.debug("Light browsing failed: {}", e.getMessage());
        }
    }

    private void openHome(Page page) {
        try {
            page.navigate(config.getSite().homeUrl());
        } catch (PlaywrightException e) {
            log.warn("Could not open home page: {}", e.getMessage());
        }
    }

    private List<SessionCookie> readCookies(BrowserSession session) {
        try {
            return session.cookies();
        } catch (PlaywrightException e) {
            log.debug("Could not read browser cookies: {}", e.getMessage());
            return List.of();
        }
    }

    private void persist(List<SessionCookie> cookies, Progress progress) {
        try {
            cookieStore.save(cookies);
        } catch (IOException e) {
            log.warn("Failed to save cookies to {}", cookieStore.getFile(), e);
            progress.report("Could not save cookies: %s", e.getMessage());
        }
    }
}
