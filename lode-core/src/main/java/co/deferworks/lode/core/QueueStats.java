package co.deferworks.lode.core;

/**
 * Point-in-time counts for one queue, or for all queues when {@code queue} is null.
 *
 * @param pending  jobs not reserved by anyone, including the delayed ones
 * @param delayed  the subset of {@code pending} whose {@code available_at} is still ahead
 * @param reserved jobs held by a worker, including reservations whose lease expired
 * @param failed   dead letters in {@code failed_jobs}
 */
public record QueueStats(String queue, long pending, long delayed, long reserved, long failed) {

    public long total() {
        return pending + reserved;
    }
}
