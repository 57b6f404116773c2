package com.luanvv.olx.contact;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.luanvv.olx.model.SessionCookie;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class CookieStore {
    private final Path file;
    private final Duration ttl;
    private final Clock clock;
    private final ObjectMapper mapper;

    public CookieStore(Path file, Duration ttl, Clock clock) {
        this.file = file;
        this.ttl = ttl;
        this.clock = clock;
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void save(List<SessionCookie> cookies) throws IOException {
        CookieFile data = new CookieFile();
        data.setSavedAt(clock.instant().toString());
        data.setCookies(new ArrayList<>(cookies));
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writeValue(file.toFile(), data);
        log.info("Saved {} cookie(s) to {}", cookies.size(), file);
    }

    public Optional<CookieSession> load() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        CookieSession session;
        try {
            CookieFile data = mapper.readValue(file.toFile(), CookieFile.class);
            if (data == null) {
                throw new IOException("no cookie data");
            }
            session = new CookieSession(cookiesOf(data), parseTimestamp(data.getSavedAt()));
        } catch (IOException | DateTimeParseException e) {
            log.warn("Cookie file {} is unreadable, discarding it: {}", file, e.getMessage());
            delete();
            return Optional.empty();
        }
        if (session.isExpired(clock.instant(), ttl)) {
            log.info("Saved cookies from {} are older than {} days, discarding them", session.getSavedAt(), ttl.toDays());
            delete();
            return Optional.empty();
        }
        if (session.getCookies().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(session);
    }

    public void delete() {
        try {
            if (Files.deleteIfExists(file)) {
                log.info("Deleted cookie file {}", file);
            }
        } catch (IOException e) {
            log.warn("Failed to delete cookie file {}: {}", file, e.getMessage());
        }
    }

    public Path getFile() {
        return file;
    }

    private static List<SessionCookie> cookiesOf(CookieFile data) throws IOException {
        if (data.getCookies() == null) {
            return List.of();
        }
        if (data.getCookies().contains(null)) {
            throw new IOException("null cookie entry");
        }
        return List.copyOf(data.getCookies());
    }

    // Files written by older versions carry a local timestamp without offset.
    private Instant parseTimestamp(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new DateTimeParseException("missing savedAt", String.valueOf(raw), 0);
        }
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(raw).atZone(clock.getZone()).toInstant();
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CookieFile {
        @JsonAlias("saved_at")
        private String savedAt;
        private List<SessionCookie> cookies;
    }
}
