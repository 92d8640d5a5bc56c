package com.phillippitts.graphicrecorder.exception;

/**
 * Base exception for all graphic-recorder application errors.
 * All domain exceptions extend this class so the WebSocket router and the REST
 * boundary can translate them in one place.
 */
public class GraphicRecorderException extends RuntimeException {

    public GraphicRecorderException(String message) {
        super(message);
    }

    public GraphicRecorderException(String message, Throwable cause) {
        super(message, cause);
    }

    public GraphicRecorderException(Throwable cause) {
        super(cause);
    }
}
