package com.example.cdnmonitor.service;

import com.example.cdnmonitor.config.MonitoringProperties;
import com.example.cdnmonitor.model.dto.MetricReading;
import com.example.cdnmonitor.model.dto.NewAlert;
import com.example.cdnmonitor.model.dto.ServerSnapshot;
import com.example.cdnmonitor.model.entity.Alert;
import com.example.cdnmonitor.model.entity.Server;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Reglas de alerta sobre el estado del servidor y la muestra recien tomada.
 * Cada regla se evalua por separado y solo propone una alerta si no hay otra
 * sin reconocer del mismo (servidor, tipo).
 */
@Service
public class AlertEvaluator {

    private static final Logger log = LoggerFactory.getLogger(AlertEvaluator.class);

    private final MonitoringStore store;
    private final Clock clock;
    private final List<Rule> rules;

    public AlertEvaluator(MonitoringStore store, MonitoringProperties props, Clock clock) {
        this.store = store;
        this.clock = clock;
        MonitoringProperties.Thresholds t = props.getThresholds();
        this.rules = List.of(
                new Rule(Alert.Type.SERVER_DOWN, Alert.Severity.CRITICAL, (server, m) ->
                        server.status() == Server.Status.DOWN
                                ? "Server " + server.hostname() + " is down and not responding to health checks."
                                : null),
                new Rule(Alert.Type.CPU_HIGH, Alert.Severity.WARNING, (server, m) ->
                        m.cpuUsage() != null && m.cpuUsage() > t.getCpuPercent()
                                ? "High CPU usage on " + server.hostname() + ": " + fixed(m.cpuUsage(), 1) + "%"
                                : null),
                new Rule(Alert.Type.MEMORY_HIGH, Alert.Severity.WARNING, (server, m) ->
                        m.memoryUsage() != null && m.memoryUsage() > t.getMemoryPercent()
                                ? "High memory usage on " + server.hostname() + ": " + fixed(m.memoryUsage(), 1) + "%"
                                : null),
                new Rule(Alert.Type.RESPONSE_SLOW, Alert.Severity.WARNING, (server, m) ->
                        m.responseTime() != null && m.responseTime() > t.getResponseTimeMs()
                                ? "Slow response time on " + server.hostname() + ": " + fixed(m.responseTime(), 0) + "ms"
                                : null)
        );
    }

    /**
     * @param server  servidor con el estado que acaba de fijar la sonda
     * @param metrics lectura del ciclo actual
     * @return alertas nuevas a insertar; vacia si no hay incumplimientos o ya estan abiertas
     */
    public List<NewAlert> evaluate(ServerSnapshot server, MetricReading metrics) {
        MetricReading reading = metrics == null ? MetricReading.empty() : metrics;
        List<NewAlert> out = new ArrayList<>();
        for (Rule rule : rules) {
            try {
                String message = rule.condition().message(server, reading);
                if (message == null) continue;
                if (store.findUnacknowledgedAlert(server.id(), rule.type()).isPresent()) {
                    log.debug("Alerta {} ya abierta para {}", rule.type(), server.hostname());
                    continue;
                }
                out.add(new NewAlert(server.id(), server.hostname(), rule.type(), rule.severity(), message, Instant.now(clock)));
            } catch (Exception ex) {
                log.error("Error evaluando la alerta {} de {}: {}", rule.type(), server.hostname(), ex.toString());
            }
        }
        return out;
    }

    /**
     * Redondeo al par sobre el valor binario exacto: 80.25 queda en 80.2 y 5000.5 en 5000.
     * {@code String.format} redondea hacia arriba y no sirve para estos mensajes.
     */
    static String fixed(double value, int decimals) {
        return new BigDecimal(value).setScale(decimals, RoundingMode.HALF_EVEN).toPlainString();
    }

    @FunctionalInterface
    private interface Condition {
        /**
         * @return mensaje de la alerta, o null si la condicion no se cumple
         */
        String message(ServerSnapshot server, MetricReading metrics);
    }

    private record Rule(Alert.Type type, Alert.Severity severity, Condition condition) {}
}
