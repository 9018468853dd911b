package com.bayousystems;

/**
 * The computation a worker applies to each task it receives.
 * <p>
 * A handler instance belongs to exactly one worker incarnation and is only ever called
 * from that worker's thread, one task at a time, so it may keep private state without
 * synchronization. Workers obtain handlers from a {@code Supplier}, so a restarted worker
 * starts with a fresh handler.
 * <p>
 * Any exception thrown becomes a {@link ErrorKind#TASK_EXECUTION_FAILURE} result and the
 * worker continues; throwing {@link FatalWorkerFault} terminates the worker instead.
 *
 * @param <P> the payload type
 * @param <R> the result type
 */
@FunctionalInterface
public interface TaskHandler<P, R> {

    R handle(Task<P> task) throws Exception;
}
