package com.example.cdnmonitor.service.collector;

import com.example.cdnmonitor.model.dto.MetricReading;
import com.example.cdnmonitor.model.dto.ServerSnapshot;
import com.example.cdnmonitor.model.entity.Server;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Despacha la lectura de metricas al colector del dialecto declarado por el servidor.
 * Siempre devuelve una lectura bien formada.
 */
@Service
public class MetricNormalizer {

    private static final Logger log = LoggerFactory.getLogger(MetricNormalizer.class);

    private final Map<Server.ApiType, MetricCollector> collectors = new EnumMap<>(Server.ApiType.class);

    public MetricNormalizer(List<MetricCollector> collectors) {
        for (MetricCollector collector : collectors) {
            MetricCollector previous = this.collectors.put(collector.dialect(), collector);
            if (previous != null) {
                throw new IllegalStateException("Colector de metricas duplicado para el dialecto " + collector.dialect());
            }
        }
        if (!this.collectors.containsKey(Server.ApiType.GENERIC)) {
            throw new IllegalStateException("Falta el colector de metricas generico");
        }
    }

    public MetricReading collect(ServerSnapshot server) {
        Server.ApiType dialect = server.apiType() == null ? Server.ApiType.GENERIC : server.apiType();
        MetricCollector collector = collectors.getOrDefault(dialect, collectors.get(Server.ApiType.GENERIC));
        try {
            MetricReading reading = collector.collect(server);
            return reading == null ? MetricReading.builder().errorCount(1).build() : reading;
        } catch (RuntimeException ex) {
            log.error("El colector {} fallo para {}", dialect, server.hostname(), ex);
            return MetricReading.builder().errorCount(1).build();
        }
    }
}
