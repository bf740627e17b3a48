package com.example.cdnmonitor.model.dto;

import java.util.List;

/**
 * Escrituras acumuladas durante un ciclo, confirmadas en una sola transaccion.
 */
public record CycleBatch(List<MetricSample> samples, List<NewAlert> alerts) {

    public CycleBatch {
        samples = samples == null ? List.of() : List.copyOf(samples);
        alerts = alerts == null ? List.of() : List.copyOf(alerts);
    }

    public boolean isEmpty() {
        return samples.isEmpty() && alerts.isEmpty();
    }
}
