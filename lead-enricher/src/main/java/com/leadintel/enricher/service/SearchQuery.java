package com.leadintel.enricher.service;

/**
 * A search prepared for the provider.
 *
 * @param query       free-text business query, e.g. "dentists"
 * @param location    free-text location, null for none
 * @param coordinates provider "ll" value such as "@30.2672,-97.7431,12z", null when geocoding failed
 */
public record SearchQuery(String query, String location, String coordinates) {

    public boolean hasCoordinates() {
        return coordinates != null;
    }
}
