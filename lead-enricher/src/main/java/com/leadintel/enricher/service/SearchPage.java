package com.leadintel.enricher.service;

import com.leadintel.enricher.model.MapsPlace;

import java.util.List;

/**
 * One page of raw results. A null nextPageToken means the provider has no further pages.
 */
public record SearchPage(List<MapsPlace> places, String nextPageToken) {

    public SearchPage {
        places = places == null ? List.of() : List.copyOf(places);
    }

    public static SearchPage empty() {
        return new SearchPage(List.of(), null);
    }

    public boolean hasMore() {
        return nextPageToken != null;
    }
}
