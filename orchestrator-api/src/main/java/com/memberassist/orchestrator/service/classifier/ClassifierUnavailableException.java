package com.memberassist.orchestrator.service.classifier;

public class ClassifierUnavailableException extends ClassificationException {

    public ClassifierUnavailableException(String message) {
        super(message);
    }

    public ClassifierUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
