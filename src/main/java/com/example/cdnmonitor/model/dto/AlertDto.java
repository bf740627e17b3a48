package com.example.cdnmonitor.model.dto;

import com.example.cdnmonitor.model.entity.Alert;

import java.time.Instant;

public record AlertDto(
        Long id,
        Long serverId,
        String serverHostname,
        Alert.Type alertType,
        Alert.Severity severity,
        String message,
        boolean acknowledged,
        Instant createdAt,
        Instant acknowledgedAt
) {

    public static AlertDto from(Alert a) {
        return new AlertDto(
                a.getId(),
                a.getServer() == null ? null : a.getServer().getId(),
                a.getServer() == null ? null : a.getServer().getHostname(),
                a.getAlertType(),
                a.getSeverity(),
                a.getMessage(),
                a.isAcknowledged(),
                a.getCreatedAt(),
                a.getAcknowledgedAt()
        );
    }
}
