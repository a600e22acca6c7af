package co.deferworks.lode.core;

/**
 * Thrown when a job kind cannot be turned into a {@link JobHandler}, either because no
 * handler is registered for it or because its factory failed.
 */
public class JobResolutionException extends Exception {

    public JobResolutionException(String message) {
        super(message);
    }

    public JobResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
