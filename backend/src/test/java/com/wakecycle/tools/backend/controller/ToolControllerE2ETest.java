package com.wakecycle.tools.backend.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wakecycle.tools.backend.BaseE2ETest;
import com.wakecycle.tools.backend.dto.AddTaskRequest;
import com.wakecycle.tools.backend.dto.LogAccomplishmentRequest;
import com.wakecycle.tools.backend.dto.UpdateTaskRequest;
import com.wakecycle.tools.backend.model.AgentState;
import com.wakecycle.tools.backend.model.Impact;
import com.wakecycle.tools.backend.model.Priority;
import com.wakecycle.tools.backend.model.TaskStatus;
import com.wakecycle.tools.backend.store.DocumentKey;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.util.List;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@AutoConfigureMockMvc
class ToolControllerE2ETest extends BaseE2ETest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void shouldReadStateAndRecordWake() throws Exception {
        mockMvc.perform(post("/tools/read_state"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.state.wake_count").value(1))
                .andExpect(jsonPath("$.state.version").value("1.0"))
                .andExpect(jsonPath("$.state.created_at").isString())
                .andExpect(jsonPath("$.state.metrics.tasks_completed").value(0));

        mockMvc.perform(post("/tools/read_state"))
                .andExpect(jsonPath("$.state.wake_count").value(2));
    }

    @Test
    void shouldWriteStateKeepingServerOwnedFields() throws Exception {
        mockMvc.perform(post("/tools/read_state"))
                .andExpect(status().isOk());

        mockMvc.perform(post("/tools/write_state")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"state\": {\"current_focus\": \"X\", \"wake_count\": 9999, \"version\": \"2.0\","
                        + " \"mood\": \"focused\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("State updated"));

        mockMvc.perform(post("/tools/read_state"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state.current_focus").value("X"))
                .andExpect(jsonPath("$.state.wake_count").value(2))
                .andExpect(jsonPath("$.state.version").value("1.0"))
                .andExpect(jsonPath("$.state.mood").value("focused"));
    }

    @Test
    void shouldIgnoreUnusableValuesInProtectedFields() throws Exception {
        mockMvc.perform(post("/tools/read_state"))
                .andExpect(status().isOk());
        String createdAt = documentStore.load(DocumentKey.STATE, AgentState.class)
                .document().orElseThrow().getCreatedAt();

        mockMvc.perform(post("/tools/write_state")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"state\": {\"current_focus\": \"X\", \"created_at\": 20240101,"
                        + " \"wake_count\": \"lots\", \"last_wake\": {\"when\": \"now\"}, \"version\": [2]}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("State updated"));

        mockMvc.perform(post("/tools/read_state"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state.current_focus").value("X"))
                .andExpect(jsonPath("$.state.wake_count").value(2))
                .andExpect(jsonPath("$.state.version").value("1.0"))
                .andExpect(jsonPath("$.state.created_at").value(createdAt));
    }

    @Test
    void shouldRejectStateWithUnusableMetrics() throws Exception {
        mockMvc.perform(post("/tools/write_state")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"state\": {\"current_focus\": \"X\", \"metrics\": \"many\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
    }

    @Test
    void shouldRejectWriteWithoutState() throws Exception {
        mockMvc.perform(post("/tools/write_state")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").exists());
    }

    @Test
    void shouldAddTasksAndReadSortedBacklog() throws Exception {
        addTask("t1", "d1", Priority.HIGH)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.task_id").value("task-001"))
                .andExpect(jsonPath("$.message").value("Task added: t1"));
        addTask("t2", "d2", Priority.URGENT)
                .andExpect(jsonPath("$.task_id").value("task-002"));

        mockMvc.perform(post("/tools/read_backlog"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(2))
                .andExpect(jsonPath("$.tasks[0].title").value("t2"))
                .andExpect(jsonPath("$.tasks[0].priority").value("urgent"))
                .andExpect(jsonPath("$.tasks[0].status").value("pending"))
                .andExpect(jsonPath("$.tasks[0].completed_at").doesNotExist())
                .andExpect(jsonPath("$.tasks[1].title").value("t1"));
    }

    @Test
    void shouldFilterBacklogByStatusParameter() throws Exception {
        addTask("t1", "d1", Priority.NORMAL);
        addTask("t2", "d2", Priority.NORMAL);
        updateTask("task-002", TaskStatus.IN_PROGRESS, null)
                .andExpect(status().isOk());

        mockMvc.perform(post("/tools/read_backlog").param("status_filter", "in_progress"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.tasks[0].id").value("task-002"));
    }

    @Test
    void shouldRejectUnknownPriority() throws Exception {
        mockMvc.perform(post("/tools/add_task")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\": \"t\", \"description\": \"d\", \"priority\": \"whenever\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldRejectTaskWithoutTitle() throws Exception {
        mockMvc.perform(post("/tools/add_task")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"description\": \"d\", \"priority\": \"low\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void shouldCompleteTask() throws Exception {
        addTask("t1", "d1", Priority.NORMAL);

        updateTask("task-001", TaskStatus.COMPLETED, "done")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Task task-001 updated to completed"));

        mockMvc.perform(post("/tools/read_backlog").param("status_filter", "completed"))
                .andExpect(jsonPath("$.tasks[0].completed_at").isString())
                .andExpect(jsonPath("$.tasks[0].notes").value("done"));

        mockMvc.perform(post("/tools/read_state"))
                .andExpect(jsonPath("$.state.metrics.tasks_completed").value(1));
    }

    @Test
    void shouldReturnNotFoundForUnknownTask() throws Exception {
        updateTask("task-404", TaskStatus.COMPLETED, null)
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("Task task-404 not found"));
    }

    @Test
    void shouldRejectUnknownStatus() throws Exception {
        addTask("t1", "d1", Priority.NORMAL);

        mockMvc.perform(post("/tools/update_task")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"task_id\": \"task-001\", \"status\": \"abandoned\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldLogAccomplishment() throws Exception {
        LogAccomplishmentRequest request = LogAccomplishmentRequest.builder()
                .category("code")
                .description("Wrote the migration")
                .impact(Impact.HIGH)
                .artifacts(List.of("db/V2__tasks.sql"))
                .build();

        mockMvc.perform(post("/tools/log_accomplishment")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Accomplishment logged"));

        mockMvc.perform(post("/tools/read_state"))
                .andExpect(jsonPath("$.state.metrics.total_accomplishments").value(1));
    }

    @Test
    void shouldSendNotificationWithDefaultChannel() throws Exception {
        mockMvc.perform(post("/tools/send_notification")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"message\": \"Need a decision on the schema\", \"priority\": \"urgent\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("Notification sent"));

        mockMvc.perform(post("/tools/read_state"))
                .andExpect(jsonPath("$.state.metrics.notifications_sent").value(1))
                .andExpect(jsonPath("$.state.last_wake").isString());
    }

    private ResultActions addTask(String title, String description,
            Priority priority) throws Exception {
        AddTaskRequest request = AddTaskRequest.builder()
                .title(title)
                .description(description)
                .priority(priority)
                .build();
        return mockMvc.perform(post("/tools/add_task")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)));
    }

    private ResultActions updateTask(String taskId, TaskStatus status,
            String notes) throws Exception {
        UpdateTaskRequest request = UpdateTaskRequest.builder()
                .taskId(taskId)
                .status(status)
                .notes(notes)
                .build();
        return mockMvc.perform(post("/tools/update_task")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)));
    }
}
