package com.scholary.inference.task;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.scholary.inference.logging.StructuredLogger;
import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory registry of task lifecycle records.
 *
 * <p>Backed by a Caffeine cache used as a concurrent map: every single-task operation goes through
 * an atomic per-key {@code compute}, so updates to one task are linearized without a global lock.
 * Listing works on a weakly consistent view and may miss updates that race with it.
 *
 * <p>Pending and running tasks never expire. Once a task reaches a terminal state it is kept for
 * the configured retention period after its last write, then dropped.
 */
@Repository
public class TaskRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(TaskRegistry.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private static final Comparator<Task> NEWEST_FIRST =
      Comparator.comparing(Task::createdAt).reversed().thenComparing(Task::id);

  private final Cache<String, Task> tasks;
  private final Clock clock;

  public TaskRegistry(
      @Value("${inference.tasks.retentionMinutes:1440}") int retentionMinutes, Clock clock) {
    this.clock = clock;
    this.tasks =
        Caffeine.newBuilder()
            .expireAfter(new TerminalTaskExpiry(Duration.ofMinutes(retentionMinutes)))
            .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
            .executor(Runnable::run)
            .build();

    LOGGER.info("Initialized task registry: retentionMinutes={}", retentionMinutes);
  }

  /**
   * Register a new pending task.
   *
   * @return the generated task id
   */
  public String create(TaskType type, String owner, TaskParams params) {
    String id = UUID.randomUUID().toString();
    tasks.put(id, Task.pending(id, type, owner, params, clock.instant()));
    structuredLogger.logTaskCreated(id, type.wireName(), owner);
    return id;
  }

  /**
   * Merge an update into a task.
   *
   * <p>A cancelled task never leaves the cancelled state: updates to it are ignored, which keeps a
   * job that did not notice its cancellation from overwriting it.
   *
   * @return false if the task is unknown, true otherwise
   */
  public boolean update(String id, TaskUpdate update) {
    AtomicReference<Task> before = new AtomicReference<>();
    Task after =
        tasks
            .asMap()
            .computeIfPresent(
                id,
                (key, current) -> {
                  before.set(current);
                  if (current.status() == TaskStatus.CANCELLED) {
                    return current;
                  }
                  return current.apply(update, clock.instant());
                });

    if (after == null) {
      LOGGER.warn("Attempt to update unknown task: {}", id);
      return false;
    }
    TaskStatus previous = before.get().status();
    if (previous == TaskStatus.CANCELLED) {
      LOGGER.debug("Ignored update to cancelled task: {}", id);
    } else if (after.status() != previous) {
      structuredLogger.logTaskTransition(id, previous.wireName(), after.status().wireName());
    }
    return true;
  }

  /**
   * Merge a loosely typed field map into a task.
   *
   * @throws IllegalArgumentException if a field carries an invalid value
   * @see TaskUpdate#fromFields(Map)
   */
  public boolean update(String id, Map<String, ?> fields) {
    return update(id, TaskUpdate.fromFields(fields));
  }

  /** Progress update from a running job; {@code message} may be null to keep the current one. */
  public boolean reportProgress(String id, int progress, String message) {
    return update(id, TaskUpdate.progress(progress, message));
  }

  public Optional<Task> get(String id) {
    return Optional.ofNullable(tasks.getIfPresent(id));
  }

  /**
   * List tasks matching all given filters, newest first.
   *
   * @param owner owner filter, or null for any
   * @param type type filter, or null for any
   * @param status status filter, or null for any
   * @param limit maximum page size
   * @param offset number of matches to skip
   */
  public TaskPage list(String owner, TaskType type, TaskStatus status, int limit, int offset) {
    if (limit < 0 || offset < 0) {
      throw new IllegalArgumentException("limit and offset must not be negative");
    }
    List<Task> matching =
        tasks.asMap().values().stream()
            .filter(task -> owner == null || owner.equals(task.owner()))
            .filter(task -> type == null || type == task.type())
            .filter(task -> status == null || status == task.status())
            .sorted(NEWEST_FIRST)
            .collect(Collectors.toList());

    int from = Math.min(offset, matching.size());
    int to = (int) Math.min((long) from + limit, matching.size());
    return new TaskPage(matching.size(), limit, offset, matching.subList(from, to));
  }

  /**
   * Cancel a pending or running task.
   *
   * @return true if the task was cancelled; false if it is unknown or already terminal
   */
  public boolean cancel(String id) {
    AtomicReference<TaskStatus> previous = new AtomicReference<>();
    tasks
        .asMap()
        .computeIfPresent(
            id,
            (key, current) -> {
              if (!current.status().isActive()) {
                return current;
              }
              previous.set(current.status());
              return current.cancel(clock.instant());
            });

    if (previous.get() == null) {
      return false;
    }
    structuredLogger.logTaskTransition(
        id, previous.get().wireName(), TaskStatus.CANCELLED.wireName());
    return true;
  }

  public boolean delete(String id) {
    boolean removed = tasks.asMap().remove(id) != null;
    if (removed) {
      LOGGER.info("Deleted task: {}", id);
    }
    return removed;
  }

  /** Token that reports cancellation once the task is cancelled or no longer tracked. */
  public CancellationToken cancellationToken(String id) {
    return () -> get(id).map(task -> task.status() == TaskStatus.CANCELLED).orElse(true);
  }

  /** Number of tracked tasks, expired ones excluded. */
  public long size() {
    tasks.cleanUp();
    return tasks.estimatedSize();
  }

  private static final class TerminalTaskExpiry implements Expiry<String, Task> {

    private final long retentionNanos;

    TerminalTaskExpiry(Duration retention) {
      this.retentionNanos = retention.toNanos();
    }

    @Override
    public long expireAfterCreate(String key, Task task, long currentTime) {
      return lifetime(task);
    }

    @Override
    public long expireAfterUpdate(String key, Task task, long currentTime, long currentDuration) {
      return lifetime(task);
    }

    @Override
    public long expireAfterRead(String key, Task task, long currentTime, long currentDuration) {
      return currentDuration;
    }

    private long lifetime(Task task) {
      return task.status().isTerminal() ? retentionNanos : Long.MAX_VALUE;
    }
  }
}
