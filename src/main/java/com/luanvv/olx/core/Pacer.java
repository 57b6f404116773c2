package com.luanvv.olx.core;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongBinaryOperator;

public class Pacer {
    private final Config.Pacing cfg;
    private final Sleeper sleeper;
    private final LongBinaryOperator random;

    public Pacer(Config.Pacing cfg, Sleeper sleeper) {
        this(cfg, sleeper, (min, max) -> max <= min ? min : ThreadLocalRandom.current().nextLong(min, max + 1));
    }

    Pacer(Config.Pacing cfg, Sleeper sleeper, LongBinaryOperator random) {
        this.cfg = cfg;
        this.sleeper = sleeper;
        this.random = random;
    }

    public void jitter() {
        between(cfg.getMinJitterMs(), cfg.getMaxJitterMs());
    }

    public void scrollPause() {
        sleeper.pause(Duration.ofMillis(cfg.getScrollPauseMs()));
    }

    /**
     * Delay after the {@code position}-th request (1-based): a long rest every
     * {@code longPauseFrequency} requests, a short delay otherwise.
     *
     * @return true when the long rest was taken
     */
    public boolean afterRequest(int position) {
        int frequency = Math.max(1, cfg.getLongPauseFrequency());
        if (position % frequency == 0) {
            between(cfg.getLongPauseMinMs(), cfg.getLongPauseMaxMs());
            return true;
        }
        between(cfg.getMinRequestDelayMs(), cfg.getMaxRequestDelayMs());
        return false;
    }

    public void rateLimited() {
        sleeper.pause(Duration.ofMillis(cfg.getRateLimitPauseMs()));
    }

    public void between(long minMs, long maxMs) {
        sleeper.pause(Duration.ofMillis(random.applyAsLong(minMs, maxMs)));
    }

    public int nextBrowsingInterval() {
        return (int) random.applyAsLong(cfg.getLightBrowsingMinInterval(), cfg.getLightBrowsingMaxInterval());
    }

    public Sleeper sleeper() {
        return sleeper;
    }
}
