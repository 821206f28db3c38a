package com.leadintel.enricher.model;

public enum JobKind {
    SINGLE, BATCH
}
