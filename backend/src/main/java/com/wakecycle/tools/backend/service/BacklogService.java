package com.wakecycle.tools.backend.service;

import com.wakecycle.tools.backend.model.Backlog;
import com.wakecycle.tools.backend.model.DefaultDocuments;
import com.wakecycle.tools.backend.model.Priority;
import com.wakecycle.tools.backend.model.StateMetric;
import com.wakecycle.tools.backend.model.Task;
import com.wakecycle.tools.backend.model.TaskStatus;
import com.wakecycle.tools.backend.model.Timestamps;
import com.wakecycle.tools.backend.store.DocumentKey;
import com.wakecycle.tools.backend.store.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Owns the backlog document: task creation, listing and status transitions.
 */
@Service
public class BacklogService {

    private static final Logger log = LoggerFactory.getLogger(BacklogService.class);

    public static final String ALL_STATUSES = "all";

    private static final Comparator<Task> BY_PRIORITY = Comparator.comparingInt(task -> Priority.rankOf(task.getPriority()));

    private final DocumentStore documentStore;
    private final StateService stateService;
    private final Clock clock;

    public BacklogService(DocumentStore documentStore, StateService stateService, Clock clock) {
        this.documentStore = documentStore;
        this.stateService = stateService;
        this.clock = clock;
    }

    /**
     * Tasks with the given status (or every task for {@value #ALL_STATUSES}), most urgent first.
     * Tasks of equal priority keep their backlog order.
     */
    public List<Task> listTasks(String statusFilter) {
        String filter = statusFilter != null ? statusFilter : ALL_STATUSES;
        log.info("Reading backlog (filter: {})", filter);

        Backlog backlog = documentStore.loadOrDefault(DocumentKey.BACKLOG, Backlog.class, DefaultDocuments::backlog);
        List<Task> tasks = backlog.tasks().stream()
                .filter(task -> ALL_STATUSES.equals(filter) || task.hasStatus(filter))
                .sorted(BY_PRIORITY)
                .collect(Collectors.toList());

        log.info("Found {} tasks", tasks.size());
        return tasks;
    }

    /**
     * Append a pending task. Ids follow the backlog size ({@code task-001}, {@code task-002}, ...),
     * skipping any id already present.
     */
    public Task addTask(String title, String description, Priority priority) {
        log.info("Adding task: {}", title);

        Task task = documentStore.update(DocumentKey.BACKLOG, Backlog.class, DefaultDocuments::backlog, backlog -> {
            List<Task> tasks = backlog.tasks();
            Set<String> taken = tasks.stream().map(Task::getId).collect(Collectors.toSet());
            int number = tasks.size() + 1;
            while (taken.contains(formatId(number))) {
                number++;
            }

            Task created = Task.builder()
                    .id(formatId(number))
                    .title(title)
                    .description(description)
                    .priority(priority.value())
                    .status(TaskStatus.PENDING.value())
                    .createdAt(Timestamps.now(clock))
                    .build();
            tasks.add(created);
            return created;
        });

        log.info("Task {} added", task.getId());
        return task;
    }

    /**
     * Move a task to a new status. Completing a task stamps {@code completed_at} and bumps the
     * {@code tasks_completed} metric, also when the task was already completed.
     *
     * @throws TaskNotFoundException if no task has the given id; nothing is written in that case
     */
    public Task updateTaskStatus(String taskId, TaskStatus status, String notes) {
        log.info("Updating task {} to {}", taskId, status.value());

        Task task = documentStore.update(DocumentKey.BACKLOG, Backlog.class, DefaultDocuments::backlog, backlog -> {
            Task match = backlog.tasks().stream()
                    .filter(candidate -> taskId.equals(candidate.getId()))
                    .findFirst()
                    .orElseThrow(() -> new TaskNotFoundException(taskId));

            String now = Timestamps.now(clock);
            match.setStatus(status.value());
            match.setUpdatedAt(now);
            if (notes != null && !notes.isEmpty()) {
                match.setNotes(notes);
            }
            if (status == TaskStatus.COMPLETED) {
                match.setCompletedAt(now);
            }
            return match;
        });

        // Separate write; the backlog change stays even if this one fails
        if (status == TaskStatus.COMPLETED) {
            stateService.bumpMetric(StateMetric.TASKS_COMPLETED);
        }

        log.info("Task {} updated to {}", taskId, status.value());
        return task;
    }

    static String formatId(int number) {
        return String.format("task-%03d", number);
    }
}
