package com.catalog.harvester.exception;

/**
 * A missing or unusable external collaborator or configuration section.
 * Fatal for the whole harvest run.
 */
public class ConfigurationException extends HarvestException {

    public ConfigurationException(final String message) {
        super(message);
    }

    public ConfigurationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
