package com.autobulk.delivery;

import com.autobulk.Job;
import com.autobulk.RecipientSource;
import com.autobulk.error.RecipientResolutionException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves static lists directly and filters against a local recipient cache file ({@code .csv}
 * with a header row, or a {@code .json} array of objects). A filter matches a record when every
 * filter entry equals the record's field of the same name.
 */
public class CachedRecipientResolver implements RecipientResolver {

    private static final Logger log = LoggerFactory.getLogger(CachedRecipientResolver.class);
    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {
    };

    static final List<Map<String, Object>> SAMPLE_RECIPIENTS = List.of(
            Map.of("email", "demo+marketing@example.com", "department", "marketing"),
            Map.of("email", "demo+sales@example.com", "department", "sales"),
            Map.of("email", "demo+eng@example.com", "department", "engineering"));

    private final Path cachePath;
    private final String addressField;
    private final ObjectMapper objectMapper;
    private final CsvMapper csvMapper = new CsvMapper();

    public CachedRecipientResolver(Path cachePath, String addressField, ObjectMapper objectMapper) {
        this.cachePath = cachePath;
        this.addressField = addressField == null || addressField.isBlank() ? "email" : addressField.trim();
        this.objectMapper = objectMapper;
    }

    @Override
    public List<String> resolve(Job job) throws RecipientResolutionException {
        if (job.getRecipientSource() == RecipientSource.STATIC_LIST) {
            List<String> recipients = job.getRecipients();
            if (recipients == null || recipients.isEmpty()) {
                throw new RecipientResolutionException("Static list job " + job.getId() + " does not define any recipients");
            }
            return List.copyOf(recipients);
        }
        return resolveFromFilter(job.getRecipientFilter() == null ? Map.of() : job.getRecipientFilter());
    }

    private List<String> resolveFromFilter(Map<String, String> filter) throws RecipientResolutionException {
        List<Map<String, Object>> records = loadCache();
        if (filter.isEmpty()) {
            log.warn("Recipient filter is empty; returning every cached recipient");
        }

        List<String> matched = new ArrayList<>();
        for (Map<String, Object> record : records) {
            if (matches(record, filter)) {
                Object address = record.get(addressField);
                if (address != null && !address.toString().isBlank()) {
                    matched.add(address.toString().trim());
                }
            }
        }
        if (matched.isEmpty()) {
            throw new RecipientResolutionException("No cached recipients matched the filter " + filter);
        }
        return matched;
    }

    private boolean matches(Map<String, Object> record, Map<String, String> filter) {
        for (Map.Entry<String, String> entry : filter.entrySet()) {
            if (!String.valueOf(record.get(entry.getKey())).equals(String.valueOf(entry.getValue()))) {
                return false;
            }
        }
        return true;
    }

    private List<Map<String, Object>> loadCache() throws RecipientResolutionException {
        if (cachePath == null || !Files.exists(cachePath)) {
            log.info("Recipient cache {} not found; using default sample recipients", cachePath);
            return SAMPLE_RECIPIENTS;
        }

        String fileName = cachePath.getFileName().toString().toLowerCase(Locale.ROOT);
        try {
            if (fileName.endsWith(".csv")) {
                return loadCsv();
            }
            if (fileName.endsWith(".json")) {
                return loadJson();
            }
        } catch (IOException e) {
            throw new RecipientResolutionException("Unable to read recipient cache " + cachePath, e);
        }
        throw new RecipientResolutionException("Unsupported recipient cache format: " + cachePath.getFileName());
    }

    private List<Map<String, Object>> loadCsv() throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, Object>> rows = csvMapper.readerFor(RECORD_TYPE)
                .with(schema)
                .readValues(cachePath.toFile())) {
            return rows.readAll();
        }
    }

    private List<Map<String, Object>> loadJson() throws IOException, RecipientResolutionException {
        JsonNode root = objectMapper.readTree(cachePath.toFile());
        if (root == null || !root.isArray()) {
            throw new RecipientResolutionException("JSON recipient cache must be a list of objects");
        }
        List<Map<String, Object>> records = new ArrayList<>(root.size());
        for (JsonNode node : root) {
            if (node.isObject()) {
                records.add(objectMapper.convertValue(node, RECORD_TYPE));
            }
        }
        return records;
    }
}
