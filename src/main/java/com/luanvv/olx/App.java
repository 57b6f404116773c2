package com.luanvv.olx;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.luanvv.olx.browser.PlaywrightLauncher;
import com.luanvv.olx.browser.SessionPool;
import com.luanvv.olx.contact.BrowserLogin;
import com.luanvv.olx.contact.ContactApiClient;
import com.luanvv.olx.contact.ContactEnricher;
import com.luanvv.olx.contact.CookieStore;
import com.luanvv.olx.contact.LoginTimeoutException;
import com.luanvv.olx.core.Config;
import com.luanvv.olx.core.ListingCrawler;
import com.luanvv.olx.core.OutputWriter;
import com.luanvv.olx.core.Pacer;
import com.luanvv.olx.core.ProgressListener;
import com.luanvv.olx.core.RateLimiter;
import com.luanvv.olx.core.Retryer;
import com.luanvv.olx.core.Sleeper;
import com.luanvv.olx.listing.DetailExtractor;
import com.luanvv.olx.listing.DetailPageParser;
import com.luanvv.olx.listing.ImageCollector;
import com.luanvv.olx.listing.ListPageDiscoverer;
import com.luanvv.olx.listing.ListingCardParser;
import com.luanvv.olx.listing.Navigator;
import com.luanvv.olx.listing.SpecAttributeParser;
import com.luanvv.olx.listing.StructuredDataParser;
import com.luanvv.olx.model.ListingRecord;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class App {

    public static void main(String[] args) {
        try {
            Options options = Options.parse(args);
            Config config = options.configPath == null ? Config.loadDefault() : Config.load(options.configPath);
            run(config, options);
        } catch (Exception e) {
            log.error("Crawler failed", e);
            System.exit(1);
        }
    }

    static void run(Config config, Options options) throws Exception {
        LocalDateTime startedAt = LocalDateTime.now();
        ObjectMapper mapper = new ObjectMapper();
        Pacer pacer = new Pacer(config.getPacing(), Sleeper.SYSTEM);
        RateLimiter limiter = new RateLimiter(config.getRateLimit());
        Navigator navigator = new Navigator(config.getRetries(), new Retryer(config.getRetries()));
        DetailPageParser detailParser = new DetailPageParser(new StructuredDataParser(mapper),
                new SpecAttributeParser(), new ImageCollector(), new HashSet<>(config.getOutput().getExcludedFields()));
        ProgressListener listener = ProgressListener.NONE;

        try (SessionPool sessions = new SessionPool(new PlaywrightLauncher(config.getBrowser()))) {
            ListingCrawler crawler = new ListingCrawler(config, sessions,
                    new ListPageDiscoverer(config, navigator, new ListingCardParser(config.getSite().getItemLinkSelector()), pacer),
                    new DetailExtractor(config, navigator, detailParser, pacer),
                    limiter, pacer);
            List<ListingRecord> records = crawler.runSelected(options.locations,
                    config.getCrawl().getMaxPages(), config.getCrawl().getMaxListings(), listener);

            if (options.fetchContacts && config.getCrawl().isFetchContacts() && !records.isEmpty()) {
                CookieStore cookieStore = new CookieStore(Path.of(config.getCookies().getFile()),
                        Duration.ofDays(config.getCookies().getTtlDays()), Clock.systemDefaultZone());
                ContactEnricher enricher = new ContactEnricher(config, new ContactApiClient(config, mapper), cookieStore,
                        new BrowserLogin(config, sessions, cookieStore, pacer, Clock.systemDefaultZone()),
                        sessions, limiter, pacer);
                try {
                    enricher.enrich(records, listener);
                } catch (LoginTimeoutException e) {
                    log.warn("Contact enrichment skipped: {}", e.getMessage());
                }
            }

            Path out = new OutputWriter(config.getOutput()).write(records, startedAt);
            log.info("Done: {} listing(s) written to {}", records.size(), out);
        }
    }

    static class Options {
        String configPath;
        List<String> locations = new ArrayList<>();
        boolean fetchContacts = true;

        static Options parse(String[] args) {
            Options options = new Options();
            for (String arg : args) {
                if (arg.equals("--no-contacts")) {
                    options.fetchContacts = false;
                } else if (arg.startsWith("--config=")) {
                    options.configPath = arg.substring("--config=".length());
                } else if (arg.startsWith("--locations=")) {
                    options.locations = Arrays.stream(arg.substring("--locations=".length()).split(","))
                            .map(String::trim)
                            .filter(s -> !s.isEmpty())
                            .collect(Collectors.toList());
                } else {
                    throw new IllegalArgumentException("Unknown argument: " + arg);
                }
            }
            return options;
        }
    }
}
