package com.example.cdnmonitor.model.dto;

import java.time.Instant;

/**
 * Orden de alta de una muestra en el almacen.
 */
public record MetricSample(Long serverId, Instant timestamp, MetricReading reading) {
}
