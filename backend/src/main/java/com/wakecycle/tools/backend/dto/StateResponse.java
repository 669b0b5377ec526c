package com.wakecycle.tools.backend.dto;

import com.wakecycle.tools.backend.model.AgentState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StateResponse {

    @Builder.Default
    private boolean success = true;

    private AgentState state;
}
