package com.phillippitts.graphicrecorder.exception;

/**
 * Thrown when a persistence read or write fails, or refers to a record that does not exist.
 */
public class StorageException extends GraphicRecorderException {

    private final String operation;

    public StorageException(String operation, String message) {
        super(message + " (operation: " + operation + ")");
        this.operation = operation;
    }

    public StorageException(String operation, String message, Throwable cause) {
        super(message + " (operation: " + operation + ")", cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
