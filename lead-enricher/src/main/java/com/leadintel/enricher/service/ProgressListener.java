package com.leadintel.enricher.service;

import com.leadintel.enricher.model.ProgressEvent;

/**
 * Receives progress events on the publisher's thread. Register as a bean to be picked up.
 */
public interface ProgressListener {

    void onProgress(ProgressEvent event);
}
