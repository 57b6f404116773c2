package com.luanvv.olx.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.luanvv.olx.browser.BrowserSession;
import com.luanvv.olx.browser.SessionCreationException;
import com.luanvv.olx.browser.SessionPool;
import com.luanvv.olx.listing.DetailExtractor;
import com.luanvv.olx.listing.ListPageDiscoverer;
import com.luanvv.olx.listing.PageResult;
import com.luanvv.olx.model.ListingBasic;
import com.luanvv.olx.model.ListingDetail;
import com.luanvv.olx.model.ListingField;
import com.luanvv.olx.model.ListingRecord;
import com.luanvv.olx.model.LocationConfig;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ListingCrawlerTest {

    private static final String LAHORE_SEED = "https://www.olx.com.pk/lahore_g4060673/cars_c84";
    private static final String KARACHI_SEED = "https://www.olx.com.pk/karachi_g4060695/cars_c84";
    private static final String QUETTA_SEED = "https://www.olx.com.pk/quetta_g4060718/cars_c84";

    private final Config config = new Config();
    private final ListPageDiscoverer discoverer = mock(ListPageDiscoverer.class);
    private final DetailExtractor extractor = mock(DetailExtractor.class);
    private final List<String> messages = new CopyOnWriteArrayList<>();
    private final ProgressListener listener = ProgressListener.of(messages::add);
    private final AtomicInteger launched = new AtomicInteger();
    private SessionPool sessions;

    @BeforeEach
    void setUp() {
        config.getCrawl().setDetailWorkers(3);
        config.getCrawl().setMaxPages(5);
        config.getCrawl().setMaxListings(3);
        config.getRateLimit().setPermitsPerSecond(1000);
        config.getRateLimit().setBurst(1000);
        config.setLocations(List.of(
            location("lahore", LAHORE_SEED, true),
            location("karachi", KARACHI_SEED, true),
            location("quetta", QUETTA_SEED, false)));
        sessions = new SessionPool(headless -> {
            launched.incrementAndGet();
            return mock(BrowserSession.class);
        });
        when(extractor.extract(any(), anyString(), any())).thenAnswer(inv ->
            ListingDetail.builder(inv.getArgument(1)).set(ListingField.TITLE, "Detail title").build());
    }

    @Test
    void crawlsEveryEnabledLocationUpToListingCap() {
        AtomicInteger ids = new AtomicInteger();
        when(discoverer.discover(any(), anyString(), anyInt(), any())).thenAnswer(inv -> {
            String url = inv.getArgument(1);
            return PageResult.ok(List.of(card(url, ids.incrementAndGet()), card(url, ids.incrementAndGet())));
        });

        List<ListingRecord> records = crawler().run(listener);

        assertThat(records).hasSize(6);
        assertThat(records.stream().collect(Collectors.groupingBy(ListingRecord::getLocationKey, Collectors.counting())))
            .containsEntry("lahore", 3L)
            .containsEntry("karachi", 3L)
            .doesNotContainKey("quetta");
        assertThat(records).allSatisfy(r -> assertThat(r.get(ListingField.TITLE)).isEqualTo("Detail title"));
        verify(discoverer).discover(any(), eq(LAHORE_SEED), eq(24), any());
        verify(discoverer).discover(any(), eq(LAHORE_SEED + "?page=2"), eq(24), any());
        verify(discoverer, never()).discover(any(), eq(LAHORE_SEED + "?page=3"), anyInt(), any());
        verify(discoverer, never()).discover(any(), startsWith(QUETTA_SEED), anyInt(), any());
        assertThat(sessions.activeCount()).isZero();
        assertThat(messages).contains("Completed! 6 listings scraped.");
    }

    @Test
    void emptyPageEndsPagination() {
        when(discoverer.discover(any(), anyString(), anyInt(), any())).thenAnswer(inv -> {
            String url = inv.getArgument(1);
            return url.contains("page=") ? PageResult.ok(List.of()) : PageResult.ok(List.of(card(url, 1)));
        });

        List<ListingRecord> records = crawler().runSelected(List.of("lahore"), 5, 0, listener);

        assertThat(records).extracting(ListingRecord::getLink).containsExactly(LAHORE_SEED + "/item/car-iid-1");
        verify(discoverer, times(2)).discover(any(), anyString(), anyInt(), any());
        assertThat(messages).contains("No items on page 2, stopping.");
    }

    @Test
    void repeatedCardsAcrossPagesAreKeptOnce() {
        when(discoverer.discover(any(), anyString(), anyInt(), any()))
            .thenAnswer(inv -> PageResult.ok(List.of(card(LAHORE_SEED, 1), card(LAHORE_SEED, 2))));

        List<ListingRecord> records = crawler().runSelected(List.of("lahore"), 5, 0, listener);

        assertThat(records).hasSize(2);
        verify(discoverer, times(5)).discover(any(), anyString(), anyInt(), any());
    }

    @Test
    void failedFirstPageYieldsNoListings() {
        when(discoverer.discover(any(), anyString(), anyInt(), any()))
            .thenReturn(PageResult.failed(new IllegalStateException("net::ERR_NAME_NOT_RESOLVED")));

        List<ListingRecord> records = crawler().runSelected(List.of("lahore", "nowhere"), 5, 50, listener);

        assertThat(records).isEmpty();
        assertThat(messages).contains("Unknown location 'nowhere', skipping", "No listings found for Lahore.");
        assertThat(sessions.activeCount()).isZero();
    }

    @Test
    void failingListingBecomesErrorRecord() {
        when(discoverer.discover(any(), anyString(), anyInt(), any()))
            .thenAnswer(inv -> PageResult.ok(List.of(card(LAHORE_SEED, 1), card(LAHORE_SEED, 2))));
        when(extractor.extract(any(), eq(LAHORE_SEED + "/item/car-iid-2"), any()))
            .thenThrow(new IllegalStateException("Target page crashed"));

        List<ListingRecord> records = crawler().runSelected(List.of("lahore"), 1, 0, listener);

        assertThat(records).hasSize(2);
        assertThat(records).filteredOn(r -> r.getError().isPresent())
            .singleElement()
            .satisfies(r -> {
                assertThat(r.getLink()).endsWith("iid-2");
                assertThat(r.getError()).contains("Target page crashed");
            });
        assertThat(sessions.activeCount()).isZero();
    }

    @Test
    void browserThatCannotStartAbortsTheCrawl() {
        SessionPool broken = new SessionPool(headless -> {
            throw new IllegalStateException("Executable doesn't exist");
        });
        ListingCrawler crawler = new ListingCrawler(config, broken, discoverer, extractor,
            new RateLimiter(config.getRateLimit()), new Pacer(config.getPacing(), Sleeper.NONE));

        assertThatThrownBy(() -> crawler.run(listener))
            .isInstanceOf(SessionCreationException.class)
            .hasMessageContaining("Executable doesn't exist");
    }

    @Test
    void workerBrowserFailureAbortsTheCrawl() {
        SessionPool flaky = new SessionPool(headless -> {
            if (launched.incrementAndGet() > 1) {
                throw new IllegalStateException("Browser closed unexpectedly");
            }
            return mock(BrowserSession.class);
        });
        when(discoverer.discover(any(), anyString(), anyInt(), any()))
            .thenAnswer(inv -> PageResult.ok(List.of(card(LAHORE_SEED, 1), card(LAHORE_SEED, 2))));
        ListingCrawler crawler = new ListingCrawler(config, flaky, discoverer, extractor,
            new RateLimiter(config.getRateLimit()), new Pacer(config.getPacing(), Sleeper.NONE));

        assertThatThrownBy(() -> crawler.runSelected(List.of("lahore"), 1, 0, listener))
            .isInstanceOf(SessionCreationException.class);
        assertThat(flaky.activeCount()).isZero();
    }

    private ListingCrawler crawler() {
        return new ListingCrawler(config, sessions, discoverer, extractor,
            new RateLimiter(config.getRateLimit()), new Pacer(config.getPacing(), Sleeper.NONE));
    }

    private static ListingBasic card(String seed, int id) {
        String base = seed.contains("?") ? seed.substring(0, seed.indexOf('?')) : seed;
        return ListingBasic.builder()
            .link(base + "/item/car-iid-" + id)
            .title("Card " + id)
            .price("Rs " + id)
            .build();
    }

    private static LocationConfig location(String key, String seed, boolean enabled) {
        return LocationConfig.builder().key(key).displayName(key.substring(0, 1).toUpperCase() + key.substring(1))
            .seedUrl(seed).enabled(enabled).build();
    }
}
