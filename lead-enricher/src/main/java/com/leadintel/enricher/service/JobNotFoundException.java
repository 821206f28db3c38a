package com.leadintel.enricher.service;

public class JobNotFoundException extends RuntimeException {

    public JobNotFoundException(String jobId) {
        super("No job " + jobId);
    }
}
