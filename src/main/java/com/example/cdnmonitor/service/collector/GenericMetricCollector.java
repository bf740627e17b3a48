package com.example.cdnmonitor.service.collector;

import com.example.cdnmonitor.model.dto.MetricReading;
import com.example.cdnmonitor.model.dto.ServerSnapshot;
import com.example.cdnmonitor.model.entity.Server;
import com.example.cdnmonitor.service.UpstreamHttpClient;
import com.example.cdnmonitor.service.UpstreamHttpClient.Budget;
import com.example.cdnmonitor.service.UpstreamHttpClient.UpstreamResponse;
import com.example.cdnmonitor.service.UpstreamTransportException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Health check HTTP generico; si el cuerpo es JSON lee connections, cpu y memory cuando existan.
 */
@Component
public class GenericMetricCollector implements MetricCollector {

    private static final Logger log = LoggerFactory.getLogger(GenericMetricCollector.class);

    private final UpstreamHttpClient http;
    private final ObjectMapper mapper;

    public GenericMetricCollector(UpstreamHttpClient http, ObjectMapper mapper) {
        this.http = http;
        this.mapper = mapper;
    }

    @Override
    public Server.ApiType dialect() {
        return Server.ApiType.GENERIC;
    }

    @Override
    public MetricReading collect(ServerSnapshot server) {
        if (!server.hasApiEndpoint()) {
            log.warn("El servidor {} no tiene endpoint de API configurado", server.hostname());
            return MetricReading.empty();
        }

        try {
            UpstreamResponse response = http.get(server, server.apiEndpoint().trim(), Budget.PRIMARY);
            MetricReading.Builder metrics = MetricReading.builder().responseTime(response.elapsedMs());
            if (!response.isOk()) {
                log.warn("Endpoint de salud de {} respondio HTTP {}", server.hostname(), response.status());
                return metrics.build();
            }
            readStructured(server, response.body(), metrics);
            return metrics.build();
        } catch (UpstreamTransportException ex) {
            log.error("No se pudieron obtener metricas de {}: {}", server.hostname(), ex.getMessage());
            return MetricReading.builder().errorCount(1).build();
        } catch (Exception ex) {
            log.error("Error inesperado obteniendo metricas de {}: {}", server.hostname(), ex.toString());
            return MetricReading.builder().errorCount(1).build();
        }
    }

    private void readStructured(ServerSnapshot server, String body, MetricReading.Builder metrics) {
        JsonNode root;
        try {
            root = mapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException ex) {
            log.debug("La respuesta de salud de {} no es JSON", server.hostname());
            return;
        }
        if (root == null || !root.isObject()) {
            return;
        }
        Integer connections = JsonValues.optionalInt(root.get("connections"));
        if (connections != null) metrics.activeConnections(connections);
        Double cpu = JsonValues.optionalDecimal(root.get("cpu"));
        if (cpu != null) metrics.cpuUsage(cpu);
        Double memory = JsonValues.optionalDecimal(root.get("memory"));
        if (memory != null) metrics.memoryUsage(memory);
    }
}
