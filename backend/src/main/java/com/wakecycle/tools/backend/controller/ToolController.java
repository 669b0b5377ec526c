package com.wakecycle.tools.backend.controller;

import com.wakecycle.tools.backend.dto.AddTaskRequest;
import com.wakecycle.tools.backend.dto.AddTaskResponse;
import com.wakecycle.tools.backend.dto.BacklogResponse;
import com.wakecycle.tools.backend.dto.LogAccomplishmentRequest;
import com.wakecycle.tools.backend.dto.SendNotificationRequest;
import com.wakecycle.tools.backend.dto.StateResponse;
import com.wakecycle.tools.backend.dto.ToolResponse;
import com.wakecycle.tools.backend.dto.UpdateTaskRequest;
import com.wakecycle.tools.backend.dto.WriteStateRequest;
import com.wakecycle.tools.backend.model.Task;
import com.wakecycle.tools.backend.service.AccomplishmentService;
import com.wakecycle.tools.backend.service.BacklogService;
import com.wakecycle.tools.backend.service.NotificationService;
import com.wakecycle.tools.backend.service.StateService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Tool endpoints called by the agent on every wake cycle.
 */
@RestController
@RequestMapping("/tools")
@Tag(name = "Tools", description = "Agent state, backlog, accomplishment and notification tools")
public class ToolController {

    private final StateService stateService;
    private final BacklogService backlogService;
    private final AccomplishmentService accomplishmentService;
    private final NotificationService notificationService;

    public ToolController(StateService stateService,
            BacklogService backlogService,
            AccomplishmentService accomplishmentService,
            NotificationService notificationService) {
        this.stateService = stateService;
        this.backlogService = backlogService;
        this.accomplishmentService = accomplishmentService;
        this.notificationService = notificationService;
    }

    @PostMapping("/read_state")
    @Operation(summary = "Read state", description = "Read the agent state and record a wake")
    public ResponseEntity<StateResponse> readState() {
        return ResponseEntity.ok(StateResponse.builder()
                .state(stateService.readState())
                .build());
    }

    @PostMapping("/write_state")
    @Operation(summary = "Write state", description = "Replace the agent state; server-owned fields are kept")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "State updated"),
            @ApiResponse(responseCode = "400", description = "Missing or unusable state")
    })
    public ResponseEntity<ToolResponse> writeState(@Valid @RequestBody WriteStateRequest request) {
        stateService.writeStateDocument(request.getState());
        return ResponseEntity.ok(ToolResponse.ok("State updated"));
    }

    @PostMapping("/read_backlog")
    @Operation(summary = "Read backlog", description = "List tasks, optionally filtered by status, most urgent first")
    public ResponseEntity<BacklogResponse> readBacklog(
            @Parameter(description = "Task status or 'all'")
            @RequestParam(name = "status_filter", defaultValue = BacklogService.ALL_STATUSES) String statusFilter) {

        List<Task> tasks = backlogService.listTasks(statusFilter);
        return ResponseEntity.ok(BacklogResponse.builder()
                .tasks(tasks)
                .total(tasks.size())
                .build());
    }

    @PostMapping("/update_task")
    @Operation(summary = "Update task", description = "Change a task's status")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Task updated"),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "404", description = "Task not found")
    })
    public ResponseEntity<ToolResponse> updateTask(@Valid @RequestBody UpdateTaskRequest request) {
        backlogService.updateTaskStatus(request.getTaskId(), request.getStatus(), request.getNotes());
        return ResponseEntity.ok(ToolResponse.ok(
                "Task " + request.getTaskId() + " updated to " + request.getStatus().value()));
    }

    @PostMapping("/add_task")
    @Operation(summary = "Add task", description = "Append a new pending task to the backlog")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Task added"),
            @ApiResponse(responseCode = "400", description = "Invalid request")
    })
    public ResponseEntity<AddTaskResponse> addTask(@Valid @RequestBody AddTaskRequest request) {
        Task task = backlogService.addTask(request.getTitle(), request.getDescription(), request.getPriority());
        return ResponseEntity.ok(AddTaskResponse.builder()
                .taskId(task.getId())
                .message("Task added: " + request.getTitle())
                .build());
    }

    @PostMapping("/log_accomplishment")
    @Operation(summary = "Log accomplishment", description = "Append completed work to the accomplishment log")
    public ResponseEntity<ToolResponse> logAccomplishment(@Valid @RequestBody LogAccomplishmentRequest request) {
        accomplishmentService.logAccomplishment(request.getCategory(), request.getDescription(),
                request.getImpact(), request.getArtifacts());
        return ResponseEntity.ok(ToolResponse.ok("Accomplishment logged"));
    }

    @PostMapping("/send_notification")
    @Operation(summary = "Send notification", description = "Notify the principal; high and urgent go to the webhook")
    public ResponseEntity<ToolResponse> sendNotification(@Valid @RequestBody SendNotificationRequest request) {
        String channel = request.getChannel() != null
                ? request.getChannel()
                : SendNotificationRequest.DEFAULT_CHANNEL;
        notificationService.send(request.getMessage(), request.getPriority(), channel);
        return ResponseEntity.ok(ToolResponse.ok("Notification sent"));
    }
}
