package com.example.cdnmonitor.model.dto;

import com.example.cdnmonitor.model.entity.Server;

import java.time.Instant;

/**
 * Vista publica de un servidor. Nunca incluye credenciales.
 */
public record ServerDto(
        Long id,
        String hostname,
        String ipAddress,
        int port,
        Server.Role role,
        Server.Status status,
        String apiEndpoint,
        Server.ApiType apiType,
        Instant createdAt,
        Instant updatedAt,
        MetricSampleDto latestMetric
) {

    public static ServerDto from(Server s, MetricSampleDto latestMetric) {
        return new ServerDto(
                s.getId(),
                s.getHostname(),
                s.getIpAddress(),
                s.getPort(),
                s.getRole(),
                s.getStatus(),
                s.getApiEndpoint(),
                s.getApiType(),
                s.getCreatedAt(),
                s.getUpdatedAt(),
                latestMetric
        );
    }
}
