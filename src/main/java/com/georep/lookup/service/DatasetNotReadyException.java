package com.georep.lookup.service;

/**
 * Thrown when a request arrives but no boundary data could be loaded.
 */
public class DatasetNotReadyException extends RuntimeException {

    public DatasetNotReadyException() {
        super("Data store not initialised.");
    }
}
