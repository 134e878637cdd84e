package com.memberassist.orchestrator.service.catalog;

public class CatalogConfigurationException extends RuntimeException {

    public CatalogConfigurationException(String message) {
        super(message);
    }

    public CatalogConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
