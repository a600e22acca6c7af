package co.deferworks.lode.driver;

/**
 * Unchecked exception wrapping JDBC errors raised by a {@link JobStore}. Seeing one means
 * the store could not be reached or refused the statement; the operation had no effect.
 */
public class JobStoreException extends RuntimeException {

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
