package org.carball.router.exception;

/**
 * Thrown by a backend collaborator when it could not produce a result.
 * Treated as transient by the engine.
 */
public class BackendExecutionException extends Exception {

    public BackendExecutionException(String message) {
        super(message);
    }

    public BackendExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
