package io.taskvault.executor;

public final class ActionFailureException extends RuntimeException {
    private final String errorClass;

    public ActionFailureException(String errorClass, String message) {
        super(message);
        this.errorClass = errorClass;
    }

    public ActionFailureException(String errorClass, String message, Throwable cause) {
        super(message, cause);
        this.errorClass = errorClass;
    }

    public String errorClass() {
        return errorClass;
    }
}
