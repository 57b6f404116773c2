package com.luanvv.olx.core;

import com.luanvv.olx.browser.BrowserSession;
import com.luanvv.olx.browser.SessionCreationException;
import com.luanvv.olx.browser.SessionPool;
import com.luanvv.olx.listing.DetailExtractor;
import com.luanvv.olx.model.ListingBasic;
import com.luanvv.olx.model.ListingDetail;
import com.luanvv.olx.model.ListingRecord;
import com.luanvv.olx.model.LocationConfig;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

@Slf4j
class DetailWorker implements Callable<Integer> {
    private final int id;
    private final SessionPool sessions;
    private final boolean headless;
    private final DetailExtractor extractor;
    private final Pacer pacer;
    private final LocationConfig location;
    private final BlockingQueue<Item> work;
    private final BlockingQueue<ListingRecord> done;
    private final Progress progress;
    private BrowserSession session;

    DetailWorker(int id, SessionPool sessions, boolean headless, DetailExtractor extractor, Pacer pacer,
                 LocationConfig location, BlockingQueue<Item> work, BlockingQueue<ListingRecord> done,
                 Progress progress) {
        this.id = id;
        this.sessions = sessions;
        this.headless = headless;
        this.extractor = extractor;
        this.pacer = pacer;
        this.location = location;
        this.work = work;
        this.done = done;
        this.progress = progress;
    }

    @Override
    public Integer call() {
        int processed = 0;
        try {
            Item item;
            while (!Thread.currentThread().isInterrupted() && (item = work.poll()) != null) {
                ListingDetail detail = extract(item.getBasic().getLink());
                done.add(ListingMerger.merge(item.getBasic(), detail, location));
                processed++;
                pacer.afterRequest(item.getPosition());
            }
        } finally {
            sessions.release(session);
            session = null;
        }
        log.debug("Detail worker {} finished after {} listing(s)", id, processed);
        return processed;
    }

    private ListingDetail extract(String link) {
        if (session == null) {
            session = sessions.create(headless);
        }
        try {
            return extractor.extract(session, link, progress);
        } catch (SessionCreationException e) {
            throw e;
        } catch (RuntimeException e) {
            progress.report("Error processing listing %s: %s", link, e.getMessage());
            if (!session.isAlive()) {
                log.warn("Worker {} lost its browser, starting a new one on next item", id);
                sessions.release(session);
                session = null;
            }
            return ListingDetail.failed(link, e.getMessage());
        }
    }

    @Value
    static class Item {
        ListingBasic basic;
        int position;
    }
}
