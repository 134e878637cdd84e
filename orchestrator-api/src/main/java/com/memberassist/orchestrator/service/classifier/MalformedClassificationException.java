package com.memberassist.orchestrator.service.classifier;

public class MalformedClassificationException extends ClassificationException {

    public MalformedClassificationException(String message) {
        super(message);
    }

    public MalformedClassificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
