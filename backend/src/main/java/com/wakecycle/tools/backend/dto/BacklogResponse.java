package com.wakecycle.tools.backend.dto;

import com.wakecycle.tools.backend.model.Task;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BacklogResponse {

    @Builder.Default
    private boolean success = true;

    private List<Task> tasks;

    private int total;
}
