package com.catalog.harvester.model;

public enum ProductStatus {
    PUBLISHED("published"),
    OUT_OF_STOCK("out_of_stock");

    private final String value;

    ProductStatus(final String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
