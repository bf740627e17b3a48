package com.example.cdnmonitor.model.dto;

import com.example.cdnmonitor.model.entity.Alert;

import java.time.Instant;

/**
 * Orden de alta de una alerta derivada por el evaluador.
 */
public record NewAlert(
        Long serverId,
        String hostname,
        Alert.Type type,
        Alert.Severity severity,
        String message,
        Instant createdAt
) {
}
