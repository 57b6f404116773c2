package com.luanvv.olx.listing;

import com.luanvv.olx.browser.BrowserSession;
import com.luanvv.olx.core.Config;
import com.luanvv.olx.core.Pacer;
import com.luanvv.olx.core.Progress;
import com.luanvv.olx.model.ListingDetail;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.WaitForSelectorState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads one listing detail page and parses it. Navigation failures propagate; a page that
 * never becomes ready yields a detail holding only the link.
 */
@Slf4j
@RequiredArgsConstructor
public class DetailExtractor {
    private final Config config;
    private final Navigator navigator;
    private final DetailPageParser parser;
    private final Pacer pacer;

    public ListingDetail extract(BrowserSession session, String url, Progress progress) {
        Page page = session.getPage();
        log.info("Navigate detail: {}", url);
        navigator.navigate(page, url, progress);

        try {
            page.waitForSelector("body", new Page.WaitForSelectorOptions()
                .setState(WaitForSelectorState.ATTACHED)
                .setTimeout(config.getTimeouts().getDetailWaitMs()));
        } catch (TimeoutError e) {
            log.warn("Detail page {} not ready after {} ms", url, config.getTimeouts().getDetailWaitMs());
            return ListingDetail.linkOnly(url);
        }

        pacer.jitter();
        for (int i = 0; i < config.getCrawl().getDetailScrollSteps(); i++) {
            try {
                session.scrollToBottom();
            } catch (PlaywrightException e) {
                log.debug("Scroll {} on {} failed: {}", i + 1, url, e.getMessage());
            }
            pacer.scrollPause();
        }

        return parser.parse(page.content(), url);
    }
}
