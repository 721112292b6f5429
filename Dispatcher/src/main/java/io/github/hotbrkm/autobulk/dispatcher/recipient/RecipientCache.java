package io.github.hotbrkm.autobulk.dispatcher.recipient;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opencsv.CSVReaderHeaderAware;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Reads the recipient cache file: CSV with a header row, or a JSON array of objects.
 * The file is read on every call so edits are picked up by the next execution.
 */
@Slf4j
public class RecipientCache {

    static final List<Map<String, String>> SAMPLE_RECIPIENTS = List.of(
            Map.of("email", "demo+marketing@example.com", "department", "marketing"),
            Map.of("email", "demo+sales@example.com", "department", "sales"),
            Map.of("email", "demo+eng@example.com", "department", "engineering"));

    private static final TypeReference<List<Map<String, Object>>> JSON_RECORDS = new TypeReference<>() {
    };

    private final Path cachePath;
    private final ObjectMapper objectMapper;

    public RecipientCache(Path cachePath, ObjectMapper objectMapper) {
        this.cachePath = Objects.requireNonNull(cachePath, "cachePath must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * Loads every cached record.
     *
     * @throws ResolutionException if the file cannot be read or has an unsupported format
     */
    public List<Map<String, String>> load() {
        if (!Files.exists(cachePath)) {
            log.info("Recipient cache {} not found; using sample recipients", cachePath);
            return SAMPLE_RECIPIENTS;
        }
        String fileName = cachePath.getFileName().toString().toLowerCase(Locale.ROOT);
        if (fileName.endsWith(".csv")) {
            return loadCsv();
        }
        if (fileName.endsWith(".json")) {
            return loadJson();
        }
        throw new ResolutionException("Unsupported recipient cache format: " + cachePath);
    }

    public Path getCachePath() {
        return cachePath;
    }

    private List<Map<String, String>> loadCsv() {
        List<Map<String, String>> records = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(cachePath, StandardCharsets.UTF_8);
             CSVReaderHeaderAware csvReader = new CSVReaderHeaderAware(reader)) {
            Map<String, String> row;
            while ((row = csvReader.readMap()) != null) {
                records.add(row);
            }
        } catch (IOException | CsvValidationException e) {
            throw new ResolutionException("Failed to read recipient cache " + cachePath, e);
        }
        log.debug("Loaded {} recipients from {}", records.size(), cachePath);
        return records;
    }

    private List<Map<String, String>> loadJson() {
        List<Map<String, Object>> raw;
        try {
            raw = objectMapper.readValue(cachePath.toFile(), JSON_RECORDS);
        } catch (IOException e) {
            throw new ResolutionException("JSON recipient cache must be a list of objects: " + cachePath, e);
        }
        List<Map<String, String>> records = new ArrayList<>(raw.size());
        for (Map<String, Object> item : raw) {
            if (item == null) {
                continue;
            }
            Map<String, String> record = new LinkedHashMap<>();
            item.forEach((key, value) -> {
                if (value != null) {
                    record.put(key, String.valueOf(value));
                }
            });
            records.add(record);
        }
        log.debug("Loaded {} recipients from {}", records.size(), cachePath);
        return records;
    }
}
