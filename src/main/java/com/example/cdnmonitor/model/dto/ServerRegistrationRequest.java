package com.example.cdnmonitor.model.dto;

import com.example.cdnmonitor.model.entity.Server;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ServerRegistrationRequest(
        @NotBlank @Size(max = 255) String hostname,
        @NotBlank @Size(max = 45) String ipAddress,
        @Min(1) @Max(65535) Integer port,
        @NotNull Server.Role role,
        @Size(max = 255) String apiEndpoint,
        Server.ApiType apiType,
        @Size(max = 512) String apiToken,
        @Size(max = 255) String apiUsername,
        @Size(max = 255) String apiPassword
) {}
