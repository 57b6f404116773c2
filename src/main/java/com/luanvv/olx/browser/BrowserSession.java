package com.luanvv.olx.browser;

import com.luanvv.olx.model.SessionCookie;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.options.Cookie;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * One Playwright browser with a single context and page. Playwright objects are not thread
 * safe, so a session is only ever used by the thread that owns it.
 */
@Slf4j
public class BrowserSession implements AutoCloseable {
    @Getter private final Playwright playwright;
    @Getter private final Browser browser;
    @Getter private final BrowserContext context;
    @Getter private final Page page;
    @Getter private final boolean headless;
    private Runnable closeHook = () -> { };
    private boolean closed;

    public BrowserSession(Playwright playwright, Browser browser, BrowserContext context, Page page, boolean headless) {
        this.playwright = playwright;
        this.browser = browser;
        this.context = context;
        this.page = page;
        this.headless = headless;
    }

    void onClose(Runnable hook) {
        this.closeHook = hook;
    }

    public void scrollToBottom() {
        page.evaluate("window.scrollTo(0, document.body.scrollHeight)");
    }

    public void scrollBy(int pixels) {
        page.evaluate("px => window.scrollBy(0, px)", pixels);
    }

    public void scrollToTop() {
        page.evaluate("window.scrollTo(0, 0)");
    }

    public List<SessionCookie> cookies() {
        List<SessionCookie> out = new ArrayList<>();
        for (Cookie c : context.cookies()) {
            SessionCookie cookie = new SessionCookie(c.name, c.value, c.domain, c.path);
            if (c.expires != null) cookie.attribute("expires", c.expires);
            if (c.httpOnly != null) cookie.attribute("httpOnly", c.httpOnly);
            if (c.secure != null) cookie.attribute("secure", c.secure);
            if (c.sameSite != null) cookie.attribute("sameSite", c.sameSite.name());
            out.add(cookie);
        }
        return out;
    }

    public boolean isAlive() {
        if (closed) {
            return false;
        }
        try {
            page.url();
            return !page.isClosed();
        } catch (RuntimeException e) {
            return false;
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (context != null) context.close();
            if (browser != null) browser.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close browser cleanly: {}", e.getMessage());
        } finally {
            if (playwright != null) playwright.close();
            closeHook.run();
        }
    }
}
