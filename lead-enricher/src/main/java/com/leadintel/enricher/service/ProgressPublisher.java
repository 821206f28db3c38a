package com.leadintel.enricher.service;

import com.leadintel.enricher.model.ProgressEvent;

/**
 * Outbound progress notifications. Implementations must not block the caller.
 */
public interface ProgressPublisher {

    void publish(ProgressEvent event);
}
