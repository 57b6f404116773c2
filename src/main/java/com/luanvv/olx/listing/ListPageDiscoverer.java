package com.luanvv.olx.listing;

import com.luanvv.olx.browser.BrowserSession;
import com.luanvv.olx.core.Config;
import com.luanvv.olx.core.Pacer;
import com.luanvv.olx.core.Progress;
import com.luanvv.olx.model.ListingBasic;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.WaitForSelectorState;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor
public class ListPageDiscoverer {
    private final Config config;
    private final Navigator navigator;
    private final ListingCardParser parser;
    private final Pacer pacer;

    public PageResult discover(BrowserSession session, String url, int maxItems, Progress progress) {
        Page page = session.getPage();
        progress.report("Loading: " + url);

        try {
            navigator.navigate(page, url, progress);
        } catch (RuntimeException e) {
            progress.report("Failed to load %s: %s", url, e.getMessage());
            return PageResult.failed(e);
        }

        try {
            page.waitForSelector(config.getSite().getItemLinkSelector(), new Page.WaitForSelectorOptions()
                .setState(WaitForSelectorState.ATTACHED)
                .setTimeout(config.getTimeouts().getPageWaitMs()));
        } catch (TimeoutError e) {
            progress.report("No listings found on page (timeout)");
            return PageResult.ok(List.of());
        } catch (PlaywrightException e) {
            progress.report("Page %s became unusable: %s", url, e.getMessage());
            return PageResult.failed(e);
        }

        for (int i = 0; i < config.getCrawl().getListScrollSteps(); i++) {
            try {
                session.scrollToBottom();
            } catch (PlaywrightException e) {
                log.debug("Scroll {} on {} failed: {}", i + 1, url, e.getMessage());
            }
            pacer.scrollPause();
        }

        List<ListingBasic> items = parser.parse(page.content(), url, maxItems);
        progress.report("Found %d listings", items.size());
        return PageResult.ok(items);
    }
}
