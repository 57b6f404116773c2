package com.luanvv.olx.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.luanvv.olx.model.ListingRecord;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class OutputWriter {
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path baseDir;
    private final Set<String> excludedFields;
    private final ObjectMapper objectMapper;

    public OutputWriter(Config.Output cfg) {
        this.baseDir = Path.of(cfg.getDir());
        this.excludedFields = new HashSet<>(cfg.getExcludedFields());
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path write(List<ListingRecord> records, LocalDateTime runStartedAt) throws IOException {
        Files.createDirectories(baseDir);
        Path path = baseDir.resolve("olx_listings_" + STAMP.format(runStartedAt) + ".json");
        List<Map<String, Object>> rows = records.stream()
                .map(r -> r.toFlatMap(excludedFields))
                .collect(Collectors.toList());
        objectMapper.writeValue(path.toFile(), rows);
        log.info("Wrote {} record(s) to {}", rows.size(), path);
        return path;
    }
}
