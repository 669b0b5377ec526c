package com.wakecycle.tools.backend.service;

import com.wakecycle.tools.backend.BaseE2ETest;
import com.wakecycle.tools.backend.model.AgentState;
import com.wakecycle.tools.backend.model.Backlog;
import com.wakecycle.tools.backend.model.DefaultDocuments;
import com.wakecycle.tools.backend.model.Priority;
import com.wakecycle.tools.backend.model.StateMetric;
import com.wakecycle.tools.backend.model.Task;
import com.wakecycle.tools.backend.model.TaskStatus;
import com.wakecycle.tools.backend.store.DocumentKey;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.nio.file.Files;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class BacklogServiceE2ETest extends BaseE2ETest {

    @Autowired
    private BacklogService backlogService;

    @Test
    void shouldAssignSequentialZeroPaddedIds() {
        Task first = backlogService.addTask("t1", "d1", Priority.NORMAL);
        Task second = backlogService.addTask("t2", "d2", Priority.LOW);

        assertEquals("task-001", first.getId());
        assertEquals("task-002", second.getId());
        assertEquals("pending", first.getStatus());
        assertNotNull(first.getCreatedAt());
        assertNull(first.getCompletedAt());
    }

    @Test
    void shouldListUrgentBeforeHigh() {
        // Given
        backlogService.addTask("t1", "d1", Priority.HIGH);
        backlogService.addTask("t2", "d2", Priority.URGENT);

        // When
        List<Task> tasks = backlogService.listTasks(BacklogService.ALL_STATUSES);

        // Then
        assertEquals(List.of("t2", "t1"), titles(tasks));
    }

    @Test
    void shouldKeepInsertionOrderAmongEqualPriorities() {
        // Given
        backlogService.addTask("a", "", Priority.HIGH);
        backlogService.addTask("b", "", Priority.URGENT);
        backlogService.addTask("c", "", Priority.HIGH);
        backlogService.addTask("d", "", Priority.LOW);
        backlogService.addTask("e", "", Priority.NORMAL);
        backlogService.addTask("f", "", Priority.URGENT);

        // When
        List<Task> tasks = backlogService.listTasks(null);

        // Then
        assertEquals(List.of("b", "f", "a", "c", "e", "d"), titles(tasks));
    }

    @Test
    void shouldRankUnknownOrMissingPriorityAsNormal() {
        // Given
        List<Task> stored = new ArrayList<>();
        stored.add(Task.builder().id("task-001").title("low").priority("low").status("pending").build());
        stored.add(Task.builder().id("task-002").title("odd").priority("critical").status("pending").build());
        stored.add(Task.builder().id("task-003").title("none").status("pending").build());
        stored.add(Task.builder().id("task-004").title("normal").priority("normal").status("pending").build());
        stored.add(Task.builder().id("task-005").title("high").priority("high").status("pending").build());
        documentStore.save(DocumentKey.BACKLOG, new Backlog(stored));

        // When
        List<Task> tasks = backlogService.listTasks("all");

        // Then
        assertEquals(List.of("high", "odd", "none", "normal", "low"), titles(tasks));
        assertEquals("critical", tasks.get(1).getPriority());
    }

    @Test
    void shouldFilterByStatus() {
        // Given
        Task first = backlogService.addTask("t1", "d1", Priority.NORMAL);
        backlogService.addTask("t2", "d2", Priority.NORMAL);
        backlogService.updateTaskStatus(first.getId(), TaskStatus.IN_PROGRESS, null);

        // When / Then
        assertEquals(List.of("t1"), titles(backlogService.listTasks("in_progress")));
        assertEquals(List.of("t2"), titles(backlogService.listTasks("pending")));
        assertTrue(backlogService.listTasks("completed").isEmpty());
        assertTrue(backlogService.listTasks("no-such-status").isEmpty());
        assertEquals(2, backlogService.listTasks("all").size());
    }

    @Test
    void shouldNotWriteWhenListing() {
        backlogService.listTasks("all");

        assertFalse(documentStore.exists(DocumentKey.BACKLOG));
    }

    @Test
    void shouldFailForUnknownTaskWithoutSideEffects() throws Exception {
        // Given
        backlogService.addTask("t1", "d1", Priority.NORMAL);
        documentStore.save(DocumentKey.STATE, DefaultDocuments.state());
        byte[] backlogBefore = Files.readAllBytes(documentStore.pathOf(DocumentKey.BACKLOG));
        byte[] stateBefore = Files.readAllBytes(documentStore.pathOf(DocumentKey.STATE));

        // When
        TaskNotFoundException e = assertThrows(TaskNotFoundException.class,
                () -> backlogService.updateTaskStatus("task-999", TaskStatus.COMPLETED, "done"));

        // Then
        assertEquals("task-999", e.getTaskId());
        assertArrayEquals(backlogBefore, Files.readAllBytes(documentStore.pathOf(DocumentKey.BACKLOG)));
        assertArrayEquals(stateBefore, Files.readAllBytes(documentStore.pathOf(DocumentKey.STATE)));
    }

    @Test
    void shouldCompleteTaskAndBumpMetric() {
        // Given
        Task task = backlogService.addTask("t1", "d1", Priority.HIGH);

        // When
        Task completed = backlogService.updateTaskStatus(task.getId(), TaskStatus.COMPLETED, "shipped");

        // Then
        assertEquals("completed", completed.getStatus());
        assertNotNull(completed.getCompletedAt());
        assertNotNull(completed.getUpdatedAt());
        assertEquals("shipped", completed.getNotes());
        assertEquals(1L, tasksCompleted());
    }

    @Test
    void shouldBumpMetricAgainWhenCompletingTwice() {
        // Given
        Task task = backlogService.addTask("t1", "d1", Priority.NORMAL);
        backlogService.updateTaskStatus(task.getId(), TaskStatus.COMPLETED, null);

        // When
        Task again = backlogService.updateTaskStatus(task.getId(), TaskStatus.COMPLETED, null);

        // Then
        assertEquals("completed", again.getStatus());
        assertNotNull(again.getCompletedAt());
        assertEquals(2L, tasksCompleted());
    }

    @Test
    void shouldNotBumpMetricForOtherTransitions() {
        Task task = backlogService.addTask("t1", "d1", Priority.NORMAL);

        Task updated = backlogService.updateTaskStatus(task.getId(), TaskStatus.IN_PROGRESS, null);

        assertEquals("in_progress", updated.getStatus());
        assertNull(updated.getCompletedAt());
        assertEquals(0L, tasksCompleted());
    }

    @Test
    void shouldKeepCompletedAtWhenReopened() {
        Task task = backlogService.addTask("t1", "d1", Priority.NORMAL);
        Task completed = backlogService.updateTaskStatus(task.getId(), TaskStatus.COMPLETED, null);

        Task reopened = backlogService.updateTaskStatus(task.getId(), TaskStatus.PENDING, null);

        assertEquals("pending", reopened.getStatus());
        assertEquals(completed.getCompletedAt(), reopened.getCompletedAt());
    }

    @Test
    void shouldKeepExistingNotesWhenNoneProvided() {
        Task task = backlogService.addTask("t1", "d1", Priority.NORMAL);
        backlogService.updateTaskStatus(task.getId(), TaskStatus.IN_PROGRESS, "halfway");

        Task updated = backlogService.updateTaskStatus(task.getId(), TaskStatus.IN_PROGRESS, "");

        assertEquals("halfway", updated.getNotes());
    }

    @Test
    void shouldSkipIdsAlreadyPresentInEditedBacklog() {
        // Given
        List<Task> stored = new ArrayList<>();
        stored.add(Task.builder().id("task-002").title("edited").priority("normal").status("pending").build());
        documentStore.save(DocumentKey.BACKLOG, new Backlog(stored));

        // When
        Task task = backlogService.addTask("new", "d", Priority.NORMAL);

        // Then
        assertEquals("task-003", task.getId());
    }

    @Test
    void shouldKeepTasksWithHandEditedTimestamps() throws Exception {
        // Given
        String stored = "{\"tasks\": ["
                + "{\"id\": \"task-001\", \"title\": \"odd\", \"priority\": \"normal\", \"status\": \"pending\","
                + " \"created_at\": \"2024-01-01\"},"
                + "{\"id\": \"task-002\", \"title\": \"plain\", \"priority\": \"high\", \"status\": \"pending\","
                + " \"created_at\": \"last tuesday\", \"completed_at\": \"\"}"
                + "]}";
        Files.createDirectories(documentStore.pathOf(DocumentKey.BACKLOG).getParent());
        Files.writeString(documentStore.pathOf(DocumentKey.BACKLOG), stored, StandardCharsets.UTF_8);

        // When
        List<Task> listed = backlogService.listTasks(BacklogService.ALL_STATUSES);
        Task added = backlogService.addTask("new", "d", Priority.LOW);

        // Then
        assertEquals(List.of("plain", "odd"), titles(listed));
        assertEquals("task-003", added.getId());
        List<Task> tasks = backlogService.listTasks(BacklogService.ALL_STATUSES);
        assertEquals(List.of("plain", "odd", "new"), titles(tasks));
        assertEquals("2024-01-01", tasks.get(1).getCreatedAt());
        assertEquals("last tuesday", tasks.get(0).getCreatedAt());
    }

    @Test
    void shouldAssignUniqueIdsUnderConcurrentAdds() throws Exception {
        int threads = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        Set<String> ids = new HashSet<>();
        try {
            List<Future<Task>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                int n = i;
                futures.add(executor.submit(() -> {
                    start.await();
                    return backlogService.addTask("t" + n, "d", Priority.NORMAL);
                }));
            }
            start.countDown();
            for (Future<Task> future : futures) {
                ids.add(future.get().getId());
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(threads, ids.size());
        assertEquals(threads, backlogService.listTasks("all").size());
    }

    private long tasksCompleted() {
        return documentStore.loadOrDefault(DocumentKey.STATE, AgentState.class, DefaultDocuments::state)
                .metric(StateMetric.TASKS_COMPLETED);
    }

    private static List<String> titles(List<Task> tasks) {
        return tasks.stream().map(Task::getTitle).collect(Collectors.toList());
    }
}
