package io.taskrelay.server.tasks;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;

import io.taskrelay.spec.Task;
import org.jspecify.annotations.Nullable;

/**
 * In-memory implementation of {@link TaskStore}.
 * <p>
 * Tasks are kept in a {@link ConcurrentHashMap} and are lost on restart. Records are immutable,
 * so values are stored as-is. This store never throws {@link TaskStoreException}.
 * </p>
 * This is the default TaskStore used when no other implementation is provided.
 */
@ApplicationScoped
public class InMemoryTaskStore implements TaskStore {

    static final Comparator<Task> BY_STATUS_TIME = Comparator
            .comparing((Task task) -> task.status().timestamp())
            .thenComparing(Task::id);

    private final ConcurrentMap<String, Task> tasks = new ConcurrentHashMap<>();

    @Override
    public void save(Task task) {
        tasks.put(task.id(), task);
    }

    @Override
    public @Nullable Task get(String taskId) {
        return tasks.get(taskId);
    }

    @Override
    public void delete(String taskId) {
        tasks.remove(taskId);
    }

    @Override
    public List<Task> list(@Nullable String contextId) {
        return tasks.values().stream()
                .filter(task -> contextId == null || contextId.equals(task.contextId()))
                .sorted(BY_STATUS_TIME)
                .toList();
    }
}
