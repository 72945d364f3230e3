package com.catalog.harvester.model;

public enum JobStatus {
    PENDING,
    RUNNING,
    SUCCESS,
    FAILED
}
