package org.carball.router.exception;

public class RouterException extends RuntimeException {

    private final ErrorKind kind;

    public RouterException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RouterException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    @Override
    public String getMessage() {
        return "[" + kind + "] " + super.getMessage();
    }
}
