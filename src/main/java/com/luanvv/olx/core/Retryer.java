package com.luanvv.olx.core;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.function.Predicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor
public class Retryer {
    private final Config.Retries cfg;
    private final Sleeper sleeper;

    public Retryer(Config.Retries cfg) {
        this(cfg, Sleeper.SYSTEM);
    }

    public <T> T runWithRetry(String opName, Callable<T> callable) throws Exception {
        return runWithRetry(opName, callable, e -> true);
    }

    public <T> T runWithRetry(String opName, Callable<T> callable, Predicate<Exception> retryable) throws Exception {
        long delay = Math.max(100, cfg.getBackoffMs());
        int attempts = 0;
        Exception last = null;
        while (attempts < cfg.getMaxAttempts()) {
            attempts++;
            try {
                return callable.call();
            } catch (Exception e) {
                last = e;
                if (!retryable.test(e)) {
                    throw e;
                }
                log.warn("{} failed on attempt {}/{}: {}", opName, attempts, cfg.getMaxAttempts(), e.toString());
                if (attempts >= cfg.getMaxAttempts()) break;
                sleeper.sleep(Duration.ofMillis(delay));
                delay = Math.min(cfg.getMaxBackoffMs(), delay * 2);
            }
        }
        throw last != null ? last : new CrawlerException(opName + " failed");
    }
}
