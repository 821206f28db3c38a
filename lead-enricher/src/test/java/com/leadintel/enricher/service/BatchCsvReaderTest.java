package com.leadintel.enricher.service;

import com.leadintel.enricher.model.SearchRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchCsvReaderTest {

    private final BatchCsvReader reader = new BatchCsvReader();

    @Test
    void readsTheSampleBatch() throws Exception {
        try (Reader source = new InputStreamReader(
                Objects.requireNonNull(getClass().getResourceAsStream("/batch/sample-searches.csv")),
                StandardCharsets.UTF_8)) {

            List<SearchRequest> requests = reader.read(source);

            assertThat(requests).containsExactly(
                    new SearchRequest("plumbers", "Austin, TX", 50),
                    new SearchRequest("dentists", "Denver, CO", 100),
                    new SearchRequest("coffee shops", null, 20));
        }
    }

    @Test
    @DisplayName("columns may come in any order, with a BOM and odd casing")
    void headerIsFlexible() throws Exception {
        String csv = "\uFEFFMax_Results,Location,QUERY\n25,\"Miami, FL\",roofers\n";

        assertThat(reader.read(new StringReader(csv)))
                .containsExactly(new SearchRequest("roofers", "Miami, FL", 25));
    }

    @Test
    void badRowsAreSkipped() throws Exception {
        String csv = """
                query,location,max_results
                ,Austin,10
                plumbers,Austin,lots
                plumbers,Austin,-5
                electricians,Austin,
                """;

        assertThat(reader.read(new StringReader(csv)))
                .containsExactly(new SearchRequest("electricians", "Austin", 100));
    }

    @Test
    void queryColumnIsRequired() {
        assertThatThrownBy(() -> reader.read(new StringReader("location,max_results\nAustin,10\n")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("query");
    }

    @Test
    void emptyFileGivesNoSearches() throws Exception {
        assertThat(reader.read(new StringReader(""))).isEmpty();
    }
}
