package com.leadintel.enricher.service;

import com.leadintel.enricher.model.ProgressEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class LoggingProgressListener implements ProgressListener {

    @Override
    public void onProgress(ProgressEvent event) {
        log.info("[{}] {}% {} - {}", event.jobId(), event.progressPercent(), event.status(), event.detailMessage());
    }
}
