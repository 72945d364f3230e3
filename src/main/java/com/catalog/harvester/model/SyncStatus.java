package com.catalog.harvester.model;

public enum SyncStatus {
    SUCCESS,
    FAILED
}
