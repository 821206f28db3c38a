package com.leadintel.enricher.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

/**
 * Raw DTO matching a single ScrapingDog Google Maps result.
 * Kept separate from the domain model to isolate API coupling.
 *
 * The provider is loose about field names and types, so the polymorphic
 * fields (gps, rating, reviews, type, hours) stay as JsonNode and are
 * interpreted by BusinessRecordMapper.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class MapsPlace {

    @JsonAlias({"name", "business_name"})
    private String title;

    @JsonProperty("place_id")
    @JsonAlias("id")
    private String placeId;

    @JsonAlias("full_address")
    private String address;

    @JsonAlias("phone_number")
    private String phone;

    @JsonAlias({"url", "link"})
    private String website;

    private JsonNode gps;

    private JsonNode rating;

    private JsonNode reviews;

    @JsonAlias({"category", "categories", "business_type"})
    private JsonNode type;

    private JsonNode hours;
}
