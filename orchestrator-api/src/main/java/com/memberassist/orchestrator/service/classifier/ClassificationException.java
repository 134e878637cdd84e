package com.memberassist.orchestrator.service.classifier;

public abstract class ClassificationException extends RuntimeException {

    protected ClassificationException(String message) {
        super(message);
    }

    protected ClassificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
