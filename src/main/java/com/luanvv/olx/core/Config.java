package com.luanvv.olx.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.luanvv.olx.model.LocationConfig;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.Data;
import lombok.extern.log4j.Log4j2;

@Log4j2
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class Config {
    private Browser browser = new Browser();
    private Site site = new Site();
    private Timeouts timeouts = new Timeouts();
    private Pacing pacing = new Pacing();
    private Crawl crawl = new Crawl();
    private RateLimit rateLimit = new RateLimit();
    private Retries retries = new Retries();
    private Cookies cookies = new Cookies();
    private Output output = new Output();
    private List<LocationConfig> locations = new ArrayList<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Browser {
        private boolean headless = true;
        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) "
            + "AppleWebKit/537.36 (KHTML, like Gecko) Chrome/131.0.0.0 Safari/537.36";
        private int windowWidth = 1920;
        private int windowHeight = 1080;
        private String locale = "en-US";
        private String fallbackChannel = "chrome";
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Site {
        private String baseUrl = "https://www.olx.com.pk";
        private String itemLinkSelector = "a[href*=\"/item/\"][href*=\"iid-\"]";
        private String contactPath = "/api/listing/{adId}/contactInfo/";
        private String probePath = "/api/user/";
        private String cookieDomain = ".olx.com.pk";

        public String homeUrl() {
            return baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Timeouts {
        private long pageWaitMs = 10_000;
        private long detailWaitMs = 8_000;
        private long loginTimeoutMs = 240_000;
        private long requestTimeoutMs = 20_000;
        private long probeTimeoutMs = 10_000;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Pacing {
        private long minJitterMs = 200;
        private long maxJitterMs = 600;
        private long scrollPauseMs = 300;
        private long minRequestDelayMs = 300;
        private long maxRequestDelayMs = 800;
        private long longPauseMinMs = 1_500;
        private long longPauseMaxMs = 2_500;
        private int longPauseFrequency = 10;
        private long rateLimitPauseMs = 5_000;
        private int lightBrowsingMinInterval = 8;
        private int lightBrowsingMaxInterval = 12;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Crawl {
        private int detailWorkers = 3;
        private int maxPages = 5;
        private int maxListings = 50;
        private int itemsPerPage = 24;
        private int listScrollSteps = 3;
        private int detailScrollSteps = 2;
        private boolean fetchContacts = true;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RateLimit {
        private double permitsPerSecond = 1.0;
        private int burst = 2;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Retries {
        private int maxAttempts = 3;
        private long backoffMs = 5_000;
        private long maxBackoffMs = 5_000;
        private int contactAttempts = 3;
        private long contactBackoffMs = 1_200;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Cookies {
        private String file = "olx_cookies.json";
        private int ttlDays = 7;
        private List<String> authCookieNames = List.of(
            "kc_access_token", "kc_refresh_token", "kc_id_token", "hb-session-id");
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Output {
        private String dir = "output";
        private List<String> excludedFields = List.of(
            "Breadcrumb Path", "Posted", "chat_available", "call_available",
            "Thumbnail Image", "proxyMobile", "roles");
    }

    public static Config load(Path path) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        try (InputStream in = Files.newInputStream(path)) {
            Config config = mapper.readValue(in, Config.class);
            config.validate();
            return config;
        }
    }

    public static Config load(String configPath) throws IOException {
        return load(Path.of(configPath));
    }

    public static Config loadDefault() throws IOException {
        String[] defaultPaths = {
            "crawler-config.yaml",
            "crawler-config.yml",
            "config/crawler-config.yaml",
            "config/crawler-config.yml",
            "src/main/resources/crawler-config.yaml",
            "src/main/resources/crawler-config.yml"
        };

        for (String defaultPath : defaultPaths) {
            Path path = Path.of(defaultPath);
            if (Files.exists(path)) {
                log.info("Using default config file: {}", path);
                return load(path);
            }
        }

        // Packaged jar
        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("crawler-config.yaml")) {
            if (in != null) {
                log.info("Using bundled crawler-config.yaml");
                Config config = new ObjectMapper(new YAMLFactory()).readValue(in, Config.class);
                config.validate();
                return config;
            }
        }

        throw new IOException("No default config file found in any of these locations: " +
                            String.join(", ", defaultPaths));
    }

    public void validate() {
        Set<String> keys = new HashSet<>();
        for (LocationConfig location : locations) {
            if (location.getKey() == null || location.getKey().isBlank()) {
                throw new IllegalArgumentException("Location without key: " + location);
            }
            if (location.getSeedUrl() == null || location.getSeedUrl().isBlank()) {
                throw new IllegalArgumentException("Location '" + location.getKey() + "' has no seedUrl");
            }
            if (!keys.add(location.getKey())) {
                throw new IllegalArgumentException("Duplicate location key: " + location.getKey());
            }
        }
        if (crawl.getDetailWorkers() < 1) {
            throw new IllegalArgumentException("crawl.detailWorkers must be >= 1");
        }
    }

    public LocationConfig findLocationByKey(String key) {
        return locations.stream()
                .filter(l -> key.equals(l.getKey()))
                .findFirst()
                .orElse(null);
    }
}
