package com.leadintel.enricher.service;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import com.leadintel.enricher.model.SearchRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses a batch upload: CSV with a header row naming the columns query, location, max_results.
 * Only query is required; max_results defaults to 100. Rows without a query or with an
 * unusable max_results are skipped with a warning.
 */
@Component
@Slf4j
public class BatchCsvReader {

    private static final String COL_QUERY = "query";
    private static final String COL_LOCATION = "location";
    private static final String COL_MAX_RESULTS = "max_results";

    public List<SearchRequest> read(Reader source) throws IOException {
        List<SearchRequest> requests = new ArrayList<>();
        int skipped = 0;

        try (CSVReader reader = new CSVReader(source)) {
            String[] header = reader.readNext();
            if (header == null) return requests;

            Map<String, Integer> columns = indexColumns(header);
            if (!columns.containsKey(COL_QUERY)) {
                throw new IllegalArgumentException("batch CSV needs a 'query' column, found " + columns.keySet());
            }

            String[] row;
            int line = 1;
            while ((row = reader.readNext()) != null) {
                line++;
                if (row.length == 1 && row[0].isBlank()) continue;

                String query = cell(row, columns.get(COL_QUERY));
                if (query == null) {
                    log.warn("Batch line {}: no query, skipped", line);
                    skipped++;
                    continue;
                }
                try {
                    requests.add(new SearchRequest(query,
                            cell(row, columns.get(COL_LOCATION)),
                            parseMaxResults(cell(row, columns.get(COL_MAX_RESULTS)))));
                } catch (IllegalArgumentException e) {
                    log.warn("Batch line {} skipped: {}", line, e.getMessage());
                    skipped++;
                }
            }
        } catch (CsvValidationException e) {
            throw new IOException("Malformed batch CSV: " + e.getMessage(), e);
        }

        log.info("Batch CSV: {} searches, {} rows skipped", requests.size(), skipped);
        return requests;
    }

    private Map<String, Integer> indexColumns(String[] header) {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            // strip a UTF-8 BOM left by spreadsheet exports
            String name = header[i].replace("\uFEFF", "").trim().toLowerCase(Locale.ROOT);
            columns.putIfAbsent(name, i);
        }
        return columns;
    }

    private String cell(String[] row, Integer index) {
        if (index == null || index >= row.length) return null;
        String value = row[index].trim();
        return value.isEmpty() ? null : value;
    }

    private int parseMaxResults(String value) {
        if (value == null) return SearchRequest.DEFAULT_MAX_RESULTS;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("max_results '" + value + "' is not a number");
        }
    }
}
