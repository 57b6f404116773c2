package com.luanvv.olx.core;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    Sleeper NONE = duration -> { };

    void sleep(Duration duration) throws InterruptedException;

    default void pause(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CrawlerException("Interrupted while pausing", e);
        }
    }
}
