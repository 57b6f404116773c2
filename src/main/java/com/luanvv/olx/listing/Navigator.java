package com.luanvv.olx.listing;

import com.luanvv.olx.core.Config;
import com.luanvv.olx.core.CrawlerException;
import com.luanvv.olx.core.Progress;
import com.luanvv.olx.core.Retryer;
import com.microsoft.playwright.Page;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Page navigation with retries for network-level failures only. Anything else (HTTP-level
 * problems, closed pages, navigation timeouts) propagates on the first attempt.
 */
@Slf4j
@RequiredArgsConstructor
public class Navigator {
    private static final List<String> TRANSIENT_MARKERS = List.of(
        "ERR_NAME_NOT_RESOLVED",
        "ERR_INTERNET_DISCONNECTED",
        "ERR_CONNECTION",
        "ERR_NETWORK_CHANGED",
        "ERR_TIMED_OUT");

    private final Config.Retries retries;
    private final Retryer retryer;

    public static boolean isTransient(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            String message = t.getMessage();
            if (message != null && TRANSIENT_MARKERS.stream().anyMatch(message::contains)) {
                return true;
            }
        }
        return false;
    }

    public void navigate(Page page, String url, Progress progress) {
        AtomicInteger attempt = new AtomicInteger();
        int maxAttempts = retries.getMaxAttempts();
        try {
            retryer.runWithRetry("navigate " + url, () -> {
                attempt.incrementAndGet();
                page.navigate(url);
                return null;
            }, e -> {
                boolean retry = isTransient(e);
                if (retry && attempt.get() < maxAttempts) {
                    progress.report("Network error (attempt %d/%d): retrying in %ds...",
                        attempt.get(), maxAttempts, retries.getBackoffMs() / 1000);
                }
                return retry;
            });
        } catch (RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CrawlerException("Interrupted while navigating to " + url, e);
        } catch (Exception e) {
            throw new CrawlerException("Navigation to " + url + " failed", e);
        }
    }
}
