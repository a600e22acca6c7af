package co.deferworks.lode.core;

/**
 * The code that runs a job. Handlers receive the job row, including its opaque payload,
 * and signal failure by throwing.
 */
@FunctionalInterface
public interface JobHandler {
    void handle(Job job) throws Exception;
}
