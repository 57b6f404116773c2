package com.luanvv.olx.browser;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class SessionPool implements AutoCloseable {
    private final BrowserLauncher launcher;
    private final Set<BrowserSession> active = new LinkedHashSet<>();

    public SessionPool(BrowserLauncher launcher) {
        this.launcher = launcher;
    }

    public BrowserSession create(boolean headless) {
        BrowserSession session;
        try {
            session = launcher.launch(headless);
        } catch (SessionCreationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SessionCreationException("Failed to create browser session: " + e.getMessage(), e);
        }
        synchronized (active) {
            active.add(session);
        }
        session.onClose(() -> untrack(session));
        return session;
    }

    public void release(BrowserSession session) {
        if (session == null) {
            return;
        }
        try {
            session.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close session: {}", e.getMessage());
        } finally {
            untrack(session);
        }
    }

    public int activeCount() {
        synchronized (active) {
            return active.size();
        }
    }

    public void closeAll() {
        List<BrowserSession> sessions;
        synchronized (active) {
            sessions = new ArrayList<>(active);
            active.clear();
        }
        if (!sessions.isEmpty()) {
            log.info("Closing {} leftover browser session(s)", sessions.size());
        }
        for (BrowserSession session : sessions) {
            try {
                session.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close session: {}", e.getMessage());
            }
        }
    }

    @Override
    public void close() {
        closeAll();
    }

    private void untrack(BrowserSession session) {
        synchronized (active) {
            active.remove(session);
        }
    }
}
