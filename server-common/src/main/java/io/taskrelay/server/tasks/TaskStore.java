package io.taskrelay.server.tasks;

import java.util.List;

import io.taskrelay.spec.Task;
import org.jspecify.annotations.Nullable;

/**
 * Storage for task records, keyed by task id.
 * <p>
 * A store only ever sees tasks that have already passed through {@link TaskLifecycle}; it does
 * not validate transitions. Saving overwrites the previous value for the same id. The request
 * handler serializes writers per task, so implementations only need to be safe for concurrent
 * access to <em>different</em> ids.
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link InMemoryTaskStore} - the default, tasks are lost on restart</li>
 *   <li>{@link FileSystemTaskStore} - one JSON file per task, survives restarts</li>
 * </ul>
 * Failures are reported as {@link TaskStoreException} or one of its subclasses.
 */
public interface TaskStore {

    /**
     * Saves or replaces a task.
     *
     * @param task the task to save
     * @throws TaskStoreException if the task could not be written
     */
    void save(Task task);

    /**
     * Retrieves a task by its ID.
     *
     * @param taskId the task identifier
     * @return the task if found, null otherwise
     * @throws TaskStoreException if the store could not be read
     */
    @Nullable Task get(String taskId);

    /**
     * Deletes a task. Deleting an unknown id is a no-op.
     *
     * @param taskId the task identifier
     * @throws TaskStoreException if the task could not be removed
     */
    void delete(String taskId);

    /**
     * Lists the tasks belonging to a context, oldest status first.
     *
     * @param contextId the context to filter on, or null for every task
     * @return the matching tasks, never null
     * @throws TaskStoreException if the store could not be read
     */
    List<Task> list(@Nullable String contextId);
}
