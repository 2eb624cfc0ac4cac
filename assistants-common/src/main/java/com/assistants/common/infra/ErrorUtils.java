package com.assistants.common.infra;

/**
 * Human-readable messages from exceptions.
 */
public final class ErrorUtils {

    private ErrorUtils() {
    }

    /**
     * Format an exception message safely. Falls back to the cause's message,
     * then to the exception's simple class name.
     *
     * @return a non-null human-readable error string
     */
    public static String formatErrorMessage(Throwable err) {
        if (err == null)
            return "Error";
        String msg = err.getMessage();
        if (msg != null && !msg.isBlank()) {
            return msg;
        }
        Throwable cause = err.getCause();
        if (cause != null && cause != err && cause.getMessage() != null && !cause.getMessage().isBlank()) {
            return cause.getMessage();
        }
        return err.getClass().getSimpleName();
    }
}
