package com.luanvv.olx.core;

import com.luanvv.olx.browser.BrowserSession;
import com.luanvv.olx.browser.SessionCreationException;
import com.luanvv.olx.browser.SessionPool;
import com.luanvv.olx.listing.DetailExtractor;
import com.luanvv.olx.listing.ListPageDiscoverer;
import com.luanvv.olx.listing.PageResult;
import com.luanvv.olx.model.ListingBasic;
import com.luanvv.olx.model.ListingRecord;
import com.luanvv.olx.model.LocationConfig;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor
public class ListingCrawler {
    private static final int REPORT_EVERY = 5;

    private final Config config;
    private final SessionPool sessions;
    private final ListPageDiscoverer discoverer;
    private final DetailExtractor extractor;
    private final RateLimiter limiter;
    private final Pacer pacer;

    public List<ListingRecord> run(ProgressListener listener) {
        return run(config.getLocations(), config.getCrawl().getMaxPages(), config.getCrawl().getMaxListings(), listener);
    }

    /**
     * Crawls the configured locations named by {@code keys}; all of them when {@code keys}
     * is null or empty. Unknown keys are reported and skipped.
     */
    public List<ListingRecord> runSelected(Collection<String> keys, int maxPagesPerLocation,
                                           int maxListingsPerLocation, ProgressListener listener) {
        if (keys == null || keys.isEmpty()) {
            return run(config.getLocations(), maxPagesPerLocation, maxListingsPerLocation, listener);
        }
        Progress progress = new Progress(listener);
        List<LocationConfig> selected = new ArrayList<>();
        for (String key : keys) {
            LocationConfig location = config.findLocationByKey(key);
            if (location == null) {
                progress.report("Unknown location '%s', skipping", key);
            } else {
                selected.add(location);
            }
        }
        return run(selected, maxPagesPerLocation, maxListingsPerLocation, listener);
    }

    public List<ListingRecord> run(List<LocationConfig> locations, int maxPagesPerLocation,
                                   int maxListingsPerLocation, ProgressListener listener) {
        Progress progress = new Progress(listener);
        List<ListingRecord> all = new ArrayList<>();
        try {
            for (LocationConfig location : locations) {
                if (!location.isEnabled()) {
                    log.info("Skipping disabled location {}", location.getKey());
                    continue;
                }
                progress.report("Starting location: %s", location.getDisplayName());
                List<ListingBasic> basics = discover(location, maxPagesPerLocation, maxListingsPerLocation, progress);
                if (basics.isEmpty()) {
                    progress.report("No listings found for %s.", location.getDisplayName());
                    continue;
                }
                progress.report("Collected %d listings for %s. Fetching details...", basics.size(), location.getDisplayName());
                List<ListingRecord> records = extractDetails(location, basics, progress);
                progress.report("Completed %s: %d listings scraped.", location.getDisplayName(), records.size());
                all.addAll(records);
            }
        } finally {
            sessions.closeAll();
        }
        progress.report("Completed! %d listings scraped.", all.size());
        return all;
    }

    List<ListingBasic> discover(LocationConfig location, int maxPages, int maxListings, Progress progress) {
        List<ListingBasic> basics = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int itemsPerPage = config.getCrawl().getItemsPerPage();
        BrowserSession session = sessions.create(config.getBrowser().isHeadless());
        try {
            for (int page = 1; page <= maxPages; page++) {
                String url = UrlUtils.pageUrl(location.getSeedUrl(), page);
                progress.report("Scraping page %d/%d of %s...", page, maxPages, location.getDisplayName());
                limiter.acquire();
                PageResult result = discoverer.discover(session, url, itemsPerPage, progress);
                if (result.isFailure()) {
                    progress.report("Stopping %s at page %d: %s", location.getDisplayName(), page,
                        result.getCause().map(Throwable::getMessage).orElse("unknown error"));
                    break;
                }
                if (result.isEmpty()) {
                    progress.report("No items on page %d, stopping.", page);
                    break;
                }
                for (ListingBasic basic : result.getItems()) {
                    if (seen.add(basic.getLink())) {
                        basics.add(basic);
                    }
                }
                if (maxListings > 0 && basics.size() >= maxListings) {
                    return new ArrayList<>(basics.subList(0, maxListings));
                }
                pacer.between(config.getPacing().getMinRequestDelayMs(), config.getPacing().getMaxRequestDelayMs());
            }
        } finally {
            sessions.release(session);
        }
        return basics;
    }

    List<ListingRecord> extractDetails(LocationConfig location, List<ListingBasic> basics, Progress progress) {
        BlockingQueue<DetailWorker.Item> work = new LinkedBlockingQueue<>();
        for (int i = 0; i < basics.size(); i++) {
            work.add(new DetailWorker.Item(basics.get(i), i + 1));
        }
        BlockingQueue<ListingRecord> done = new LinkedBlockingQueue<>();
        int workerCount = Math.min(config.getCrawl().getDetailWorkers(), basics.size());

        ExecutorService executor = Executors.newFixedThreadPool(workerCount, workerThreads(location));
        List<Future<Integer>> workers = new ArrayList<>();
        for (int i = 0; i < workerCount; i++) {
            workers.add(executor.submit(new DetailWorker(i + 1, sessions, config.getBrowser().isHeadless(),
                extractor, pacer, location, work, done, progress)));
        }

        List<ListingRecord> results = new ArrayList<>(basics.size());
        Set<Future<Integer>> inspected = new HashSet<>();
        try {
            while (results.size() < basics.size()) {
                ListingRecord record = done.poll(250, TimeUnit.MILLISECONDS);
                if (record != null) {
                    results.add(record);
                    if (results.size() % REPORT_EVERY == 0) {
                        progress.report("Processed %d/%d listings...", results.size(), basics.size());
                    }
                } else if (checkWorkers(workers, inspected, progress) && done.isEmpty()) {
                    progress.report("Workers stopped with %d of %d listings processed", results.size(), basics.size());
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CrawlerException("Interrupted while extracting details", e);
        } finally {
            executor.shutdownNow();
            awaitTermination(executor);
        }
        return results;
    }

    /**
     * @return true when every worker has finished
     * @throws SessionCreationException when a worker could not start its browser
     */
    private boolean checkWorkers(List<Future<Integer>> workers, Set<Future<Integer>> inspected,
                                 Progress progress) throws InterruptedException {
        boolean allDone = true;
        for (Future<Integer> worker : workers) {
            if (!worker.isDone()) {
                allDone = false;
                continue;
            }
            if (!inspected.add(worker)) {
                continue;
            }
            try {
                worker.get();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof SessionCreationException sce) {
                    progress.report("Browser could not be started: %s", sce.getMessage());
                    throw sce;
                }
                progress.report("Detail worker failed: %s", String.valueOf(cause));
                log.error("Detail worker failed", cause);
            }
        }
        return allDone;
    }

    private static ThreadFactory workerThreads(LocationConfig location) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "detail-" + location.getKey() + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static void awaitTermination(ExecutorService executor) {
        try {
            if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
                log.warn("Detail workers did not stop within 60s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
