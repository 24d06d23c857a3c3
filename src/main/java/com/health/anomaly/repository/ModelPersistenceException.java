package com.health.anomaly.repository;

public class ModelPersistenceException extends RuntimeException {

    public ModelPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
