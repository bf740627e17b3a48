package com.example.cdnmonitor.model.dto;

import java.util.Map;

public record DashboardStatsDto(
        int totalServers,
        Map<String, Integer> statusCounts,
        Map<String, Integer> roleCounts,
        long totalConnections
) {}
