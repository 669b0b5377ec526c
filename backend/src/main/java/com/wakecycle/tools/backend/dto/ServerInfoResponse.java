package com.wakecycle.tools.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServerInfoResponse {

    private String name;
    private String version;
    private String description;
    private List<String> tools;
}
