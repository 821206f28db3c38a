package com.leadintel.enricher.service;

import com.leadintel.enricher.model.ProgressEvent;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Hands events to every ProgressListener on a single background thread, in publish order.
 * A failing listener is logged and does not affect the others.
 */
@Component
@Slf4j
public class AsyncProgressPublisher implements ProgressPublisher {

    private final List<ProgressListener> listeners;
    private final ExecutorService dispatcher = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "progress-dispatch");
        t.setDaemon(true);
        return t;
    });

    public AsyncProgressPublisher(List<ProgressListener> listeners) {
        this.listeners = List.copyOf(listeners);
    }

    @Override
    public void publish(ProgressEvent event) {
        try {
            dispatcher.execute(() -> dispatch(event));
        } catch (RejectedExecutionException e) {
            log.debug("Progress dispatcher stopped, dropping event for {}", event.jobId());
        }
    }

    private void dispatch(ProgressEvent event) {
        for (ProgressListener listener : listeners) {
            try {
                listener.onProgress(event);
            } catch (RuntimeException e) {
                log.warn("Progress listener {} failed for {}: {}",
                        listener.getClass().getSimpleName(), event.jobId(), e.getMessage());
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        dispatcher.shutdown();
    }
}
