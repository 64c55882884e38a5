package io.taskrelay.server.tasks;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.taskrelay.spec.Task;
import io.taskrelay.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TaskStore} keeping one JSON document per task in a directory.
 * <p>
 * A save writes the task to a temporary file in the same directory and then moves it over
 * the previous version, so a reader sees either the old or the new task but never a partial one.
 * Any task id is accepted. File names are the id with every byte outside {@code [a-z0-9_-]}
 * percent-encoded, which keeps names distinct on case-insensitive file systems.
 */
public class FileSystemTaskStore implements TaskStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileSystemTaskStore.class);

    static final String SUFFIX = ".json";
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private final Path directory;

    /**
     * @param directory the directory holding task files, created if missing
     * @throws TaskPersistenceException if the directory cannot be created
     */
    public FileSystemTaskStore(Path directory) {
        this.directory = directory;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new TaskPersistenceException(null, "Cannot create task directory " + directory, e);
        }
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public void save(Task task) {
        Path target = fileFor(task.id());
        String json;
        try {
            json = Utils.toJsonString(task);
        } catch (JsonProcessingException e) {
            throw new TaskSerializationException(task.id(), "Failed to serialize task", e);
        }

        Path temp = null;
        try {
            temp = Files.createTempFile(directory, fileName(task.id()) + ".", ".tmp");
            Files.writeString(temp, json, StandardCharsets.UTF_8);
            moveIntoPlace(temp, target);
            temp = null;
        } catch (IOException e) {
            throw new TaskPersistenceException(task.id(), "Failed to write task file " + target, e, true);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
        LOGGER.debug("Saved task {} to {}", task.id(), target);
    }

    @Override
    public @Nullable Task get(String taskId) {
        return read(taskId, fileFor(taskId));
    }

    @Override
    public void delete(String taskId) {
        Path file = fileFor(taskId);
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new TaskPersistenceException(taskId, "Failed to delete task file " + file, e);
        }
    }

    @Override
    public List<Task> list(@Nullable String contextId) {
        List<Task> tasks = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                String taskId;
                try {
                    taskId = idOf(name.substring(0, name.length() - SUFFIX.length()));
                } catch (IllegalArgumentException e) {
                    LOGGER.warn("Skipping {}: not a task file name", file);
                    continue;
                }
                Task task = read(taskId, file);
                if (task != null && (contextId == null || contextId.equals(task.contextId()))) {
                    tasks.add(task);
                }
            }
        } catch (IOException e) {
            throw new TaskPersistenceException(null, "Failed to list task directory " + directory, e, true);
        }
        tasks.sort(InMemoryTaskStore.BY_STATUS_TIME);
        return tasks;
    }

    private @Nullable Task read(String taskId, Path file) {
        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            throw new TaskPersistenceException(taskId, "Failed to read task file " + file, e, true);
        }
        return parse(taskId, json);
    }

    private Task parse(String taskId, String json) {
        try {
            return Utils.unmarshalFrom(json, Task.TYPE_REFERENCE);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new TaskSerializationException(taskId, "Failed to deserialize task file", e);
        }
    }

    private Path fileFor(String taskId) {
        return directory.resolve(fileName(taskId) + SUFFIX);
    }

    static String fileName(String taskId) {
        StringBuilder name = new StringBuilder(taskId.length());
        for (byte b : taskId.getBytes(StandardCharsets.UTF_8)) {
            char c = (char) (b & 0xFF);
            if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '-' || c == '_') {
                name.append(c);
            } else {
                name.append('%').append(HEX[c >> 4]).append(HEX[c & 0xF]);
            }
        }
        return name.toString();
    }

    static String idOf(String fileName) {
        // encoded names never contain '+', so form decoding is exact
        return URLDecoder.decode(fileName, StandardCharsets.UTF_8);
    }

    private static void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOGGER.debug("Atomic move not supported for {}, falling back to a plain replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOGGER.warn("Could not remove temporary file {}", file, e);
        }
    }
}
