package com.example.cdnmonitor.service.collector;

import com.example.cdnmonitor.model.dto.MetricReading;
import com.example.cdnmonitor.model.dto.ServerSnapshot;
import com.example.cdnmonitor.model.entity.Server;
import com.example.cdnmonitor.service.UpstreamHttpClient;
import com.example.cdnmonitor.service.UpstreamHttpClient.Budget;
import com.example.cdnmonitor.service.UpstreamHttpClient.UpstreamResponse;
import com.example.cdnmonitor.service.UpstreamTransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Modulo stub_status de NGINX (texto plano).
 */
@Component
public class NginxMetricCollector implements MetricCollector {

    private static final Logger log = LoggerFactory.getLogger(NginxMetricCollector.class);

    private static final String ACTIVE_LABEL = "Active connections:";
    // accepts handled requests
    private static final Pattern COUNTERS_LINE = Pattern.compile("\\d+(\\s+\\d+){2,}");

    private final UpstreamHttpClient http;

    public NginxMetricCollector(UpstreamHttpClient http) {
        this.http = http;
    }

    @Override
    public Server.ApiType dialect() {
        return Server.ApiType.NGINX;
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
                log.warn("Endpoint stub_status de {} respondio HTTP {}", server.hostname(), response.status());
                return metrics.build();
            }
            return metrics.activeConnections(parseActiveConnections(response.body())).build();
        } catch (UpstreamTransportException ex) {
            log.error("No se pudieron obtener metricas de {}: {}", server.hostname(), ex.getMessage());
            return MetricReading.builder().errorCount(1).build();
        } catch (Exception ex) {
            log.error("Error inesperado obteniendo metricas de {}: {}", server.hostname(), ex.toString());
            return MetricReading.builder().errorCount(1).build();
        }
    }

    /**
     * La linea "Active connections: N" manda; la linea de contadores solo se usa si falta.
     *
     * @return null si el cuerpo no contiene ninguna de las dos
     * @throws NumberFormatException si la linea etiquetada no trae un entero
     */
    static Integer parseActiveConnections(String body) {
        if (body == null) return null;
        Integer fallback = null;
        for (String raw : body.strip().split("\\R")) {
            String line = raw.strip();
            int idx = line.indexOf(ACTIVE_LABEL);
            if (idx >= 0) {
                String value = line.substring(idx + ACTIVE_LABEL.length()).strip();
                return Integer.parseInt(value.split("\\s+")[0]);
            }
            if (fallback == null && COUNTERS_LINE.matcher(line).matches()) {
                fallback = Integer.parseInt(line.split("\\s+")[0]);
            }
        }
        return fallback;
    }
}
