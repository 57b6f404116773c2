package com.luanvv.olx.browser;

import com.luanvv.olx.core.Config;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Launches Chromium configured to look like a regular desktop Chrome. Falls back once to
 * the installed Chrome channel when the bundled browser cannot start.
 */
@Slf4j
@RequiredArgsConstructor
public class PlaywrightLauncher implements BrowserLauncher {
    static final String MASK_WEBDRIVER =
        "Object.defineProperty(navigator, 'webdriver', {get: () => undefined})";

    private final Config.Browser config;

    @Override
    public BrowserSession launch(boolean headless) {
        try {
            return start(headless, null);
        } catch (RuntimeException primary) {
            String channel = config.getFallbackChannel();
            if (channel == null || channel.isBlank()) {
                throw new SessionCreationException("Failed to start browser. Ensure Chromium or Chrome is installed", primary);
            }
            log.warn("Bundled Chromium failed to start ({}), trying channel '{}'", primary.getMessage(), channel);
            try {
                return start(headless, channel);
            } catch (RuntimeException fallback) {
                SessionCreationException error = new SessionCreationException(
                    "Failed to start browser. Ensure Google Chrome is installed. Error: " + primary.getMessage(), primary);
                error.addSuppressed(fallback);
                throw error;
            }
        }
    }

    List<String> launchArgs() {
        return List.of(
            "--no-sandbox",
            "--disable-dev-shm-usage",
            "--disable-gpu",
            "--window-size=" + config.getWindowWidth() + "," + config.getWindowHeight(),
            "--lang=" + config.getLocale(),
            "--disable-extensions",
            "--disable-infobars",
            "--disable-notifications",
            "--disable-blink-features=AutomationControlled");
    }

    private BrowserSession start(boolean headless, String channel) {
        Playwright playwright = Playwright.create();
        try {
            BrowserType.LaunchOptions options = new BrowserType.LaunchOptions()
                .setHeadless(headless)
                .setArgs(launchArgs())
                .setIgnoreDefaultArgs(List.of("--enable-automation"));
            if (channel != null) {
                options.setChannel(channel);
            }
            Browser browser = playwright.chromium().launch(options);
            BrowserContext context = browser.newContext(new Browser.NewContextOptions()
                .setUserAgent(config.getUserAgent())
                .setViewportSize(config.getWindowWidth(), config.getWindowHeight())
                .setLocale(config.getLocale()));
            context.addInitScript(MASK_WEBDRIVER);
            Page page = context.newPage();
            log.debug("Started {} browser (headless={})", channel == null ? "bundled" : channel, headless);
            return new BrowserSession(playwright, browser, context, page, headless);
        } catch (RuntimeException e) {
            playwright.close();
            throw e;
        }
    }
}
