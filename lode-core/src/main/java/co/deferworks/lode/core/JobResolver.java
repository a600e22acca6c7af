package co.deferworks.lode.core;

/**
 * Maps a job kind to the handler that runs it.
 */
public interface JobResolver {

    /**
     * Returns a handler for the given kind.
     *
     * @param kind The stable job-type identifier stored with the job.
     * @return A handler ready to run the job.
     * @throws JobResolutionException if the kind is unknown or its handler cannot be created.
     */
    JobHandler resolve(String kind) throws JobResolutionException;

    /**
     * Whether {@link #resolve(String)} knows the kind. Used to reject dispatches early.
     */
    boolean canResolve(String kind);
}
