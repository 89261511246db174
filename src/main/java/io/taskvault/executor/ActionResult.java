package io.taskvault.executor;

public record ActionResult(
        boolean success,
        String output,
        String errorClass,
        String error
) {
    public static ActionResult ok(String output) {
        return new ActionResult(true, output, null, null);
    }

    public static ActionResult fail(String errorClass, String error) {
        return new ActionResult(false, null, errorClass, error);
    }
}
