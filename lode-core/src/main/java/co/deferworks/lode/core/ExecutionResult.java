package co.deferworks.lode.core;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;

/**
 * The outcome of running one job. Failures carry what went wrong as plain values so that
 * the retry policy and the dead-letter path never deal with exception objects.
 *
 * @param failureKind  null on success
 * @param errorMessage one-line description of the failure, null on success
 * @param errorDetails exception class, message and stack trace, null on success
 * @param elapsed      wall-clock time spent resolving and running the handler
 */
public record ExecutionResult(
        FailureKind failureKind,
        String errorMessage,
        String errorDetails,
        Duration elapsed
) {

    public enum FailureKind {
        // No handler could be produced for the job's kind.
        RESOLUTION,

        // The handler ran and threw.
        HANDLER,
    }

    public static ExecutionResult success(Duration elapsed) {
        return new ExecutionResult(null, null, null, elapsed);
    }

    public static ExecutionResult failure(FailureKind kind, Throwable cause, Duration elapsed) {
        var message = cause.getMessage() == null ? cause.getClass().getName() : cause.getMessage();
        return new ExecutionResult(kind, message, describe(cause), elapsed);
    }

    public boolean succeeded() {
        return failureKind == null;
    }

    private static String describe(Throwable cause) {
        var writer = new StringWriter();
        cause.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }
}
