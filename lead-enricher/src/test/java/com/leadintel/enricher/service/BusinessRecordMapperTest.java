package com.leadintel.enricher.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadintel.enricher.model.BusinessRecord;
import com.leadintel.enricher.model.MapsPlace;
import com.leadintel.enricher.store.TestDatabase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BusinessRecordMapperTest {

    private final ObjectMapper objectMapper = TestDatabase.objectMapper();
    private final BusinessRecordMapper mapper = new BusinessRecordMapper(
            Clock.fixed(Instant.parse("2026-03-04T10:00:00Z"), ZoneOffset.UTC));

    private MapsPlace parse(String json) throws Exception {
        return objectMapper.readValue(json, MapsPlace.class);
    }

    @Test
    void mapsAFullResult() throws Exception {
        MapsPlace raw = parse("""
                {"title": "  Acme Plumbing ", "place_id": "ChIJ123", "address": "1 Main St, Austin, TX",
                 "phone": "512.555.0100", "website": "https://acme.com",
                 "gps": {"latitude": 30.27, "longitude": -97.74},
                 "rating": 4.7, "reviews": 213, "type": "Plumber",
                 "hours": {"monday": "8AM-5PM"}}
                """);

        BusinessRecord record = mapper.map(raw, "job123");

        assertThat(record.getPlaceId()).isEqualTo("ChIJ123");
        assertThat(record.getName()).isEqualTo("Acme Plumbing");
        assertThat(record.getPhone()).isEqualTo("(512) 555-0100");
        assertThat(record.getLatitude()).isEqualTo(30.27);
        assertThat(record.getLongitude()).isEqualTo(-97.74);
        assertThat(record.getRating()).isEqualTo(4.7);
        assertThat(record.getReviewCount()).isEqualTo(213);
        assertThat(record.getFirstSeenAt()).isEqualTo(LocalDateTime.of(2026, 3, 4, 10, 0));
        assertThat(record.getCategories()).containsExactly("Plumber");
        assertThat(record.getHoursJson()).contains("monday");
        assertThat(record.getSourceSearch()).isEqualTo("job123");
        assertThat(record.hasWebsite()).isTrue();
    }

    @Test
    @DisplayName("loosely typed fields: string gps, string rating, review text, category list")
    void looseTypes() throws Exception {
        MapsPlace raw = parse("""
                {"title": "Acme", "place_id": "p", "gps": "30.5, -97.5", "rating": "4.2",
                 "reviews": "1,234 reviews", "categories": ["Plumber", "Plumber", "Contractor"]}
                """);

        BusinessRecord record = mapper.map(raw, "job");

        assertThat(record.getLatitude()).isEqualTo(30.5);
        assertThat(record.getLongitude()).isEqualTo(-97.5);
        assertThat(record.getRating()).isEqualTo(4.2);
        assertThat(record.getReviewCount()).isEqualTo(1234);
        assertThat(record.getCategories()).containsExactly("Plumber", "Contractor");
        assertThat(record.hasWebsite()).isFalse();
    }

    @Test
    void unparseableValuesBecomeNull() throws Exception {
        BusinessRecord record = mapper.map(parse("""
                {"title": "Acme", "place_id": "p", "gps": "somewhere", "rating": "n/a", "reviews": "none"}
                """), "job");

        assertThat(record.getLatitude()).isNull();
        assertThat(record.getRating()).isNull();
        assertThat(record.getReviewCount()).isNull();
    }

    @Test
    @DisplayName("a missing place id is derived from name and address, stably")
    void derivedPlaceId() throws Exception {
        BusinessRecord a = mapper.map(parse("{\"title\": \"Acme\", \"address\": \"1 Main St\"}"), "job1");
        BusinessRecord b = mapper.map(parse("{\"title\": \"ACME \", \"address\": \" 1 main st\"}"), "job2");

        assertThat(a.getPlaceId()).startsWith("gen:").isEqualTo(b.getPlaceId());
    }

    @Test
    void missingNameIsRejected() throws Exception {
        MapsPlace raw = parse("{\"place_id\": \"p1\", \"title\": \"  \"}");

        assertThatThrownBy(() -> mapper.map(raw, "job"))
                .isInstanceOf(RecordValidationException.class)
                .hasMessageContaining("p1");
    }

    @Test
    void phoneFormats() {
        assertThat(BusinessRecordMapper.cleanPhone("512-555-0100")).isEqualTo("(512) 555-0100");
        assertThat(BusinessRecordMapper.cleanPhone("+1 512 555 0100")).isEqualTo("+1 (512) 555-0100");
        assertThat(BusinessRecordMapper.cleanPhone(" +44 20 7946 0958 ")).isEqualTo("+44 20 7946 0958");
        assertThat(BusinessRecordMapper.cleanPhone("  ")).isNull();
    }
}
