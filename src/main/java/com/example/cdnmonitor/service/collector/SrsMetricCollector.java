package com.example.cdnmonitor.service.collector;

import com.example.cdnmonitor.model.dto.BandwidthReading;
import com.example.cdnmonitor.model.dto.MetricReading;
import com.example.cdnmonitor.model.dto.ServerSnapshot;
import com.example.cdnmonitor.model.entity.Server;
import com.example.cdnmonitor.service.UpstreamHttpClient;
import com.example.cdnmonitor.service.UpstreamHttpClient.Budget;
import com.example.cdnmonitor.service.UpstreamHttpClient.UpstreamResponse;
import com.example.cdnmonitor.service.UpstreamTransportException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Servidor de medios SRS: clientes desde /api/v1/clients y ancho de banda desde
 * /api/v1/streams, con /api/v1/summaries como respaldo.
 */
@Component
public class SrsMetricCollector implements MetricCollector {

    private static final Logger log = LoggerFactory.getLogger(SrsMetricCollector.class);

    static final String CLIENTS_PATH = "/api/v1/clients";
    static final String STREAMS_PATH = "/api/v1/streams";
    static final String SUMMARIES_PATH = "/api/v1/summaries";

    private static final double KBPS_PER_MBPS = 1000.0;

    private final UpstreamHttpClient http;
    private final ObjectMapper mapper;

    public SrsMetricCollector(UpstreamHttpClient http, ObjectMapper mapper) {
        this.http = http;
        this.mapper = mapper;
    }

    @Override
    public Server.ApiType dialect() {
        return Server.ApiType.SRS;
    }

    @Override
    public MetricReading collect(ServerSnapshot server) {
        String base = server.apiBase();
        if (base == null) {
            log.warn("El servidor {} no tiene endpoint de API configurado", server.hostname());
            return MetricReading.empty();
        }

        try {
            UpstreamResponse response = http.get(server, base + CLIENTS_PATH, Budget.PRIMARY);
            MetricReading.Builder metrics = MetricReading.builder().responseTime(response.elapsedMs());
            if (!response.isOk()) {
                log.warn("Endpoint de clientes SRS de {} respondio HTTP {}", server.hostname(), response.status());
                return metrics.build();
            }

            JsonNode clients = mapper.readTree(response.body()).path("clients");
            int total = 0;
            int hls = 0;
            if (clients.isArray()) {
                for (JsonNode client : clients) {
                    total++;
                    if ("hls".equals(client.path("type").asText(null))) {
                        hls++;
                    }
                }
            }
            metrics.activeConnections(total).hlsConnections(hls);

            return metrics.bandwidth(fetchBandwidth(server, base)).build();
        } catch (UpstreamTransportException ex) {
            log.error("No se pudieron obtener metricas de {}: {}", server.hostname(), ex.getMessage());
            return MetricReading.builder().errorCount(1).build();
        } catch (Exception ex) {
            log.error("Error inesperado obteniendo metricas de {}: {}", server.hostname(), ex.toString());
            return MetricReading.builder().errorCount(1).build();
        }
    }

    /**
     * Best-effort: nunca lanza. {@link BandwidthReading#unavailable()} si ninguna fuente responde.
     */
    BandwidthReading fetchBandwidth(ServerSnapshot server, String base) {
        BandwidthReading streams = readStreams(server, base);
        if (streams.isAvailable()) {
            return streams;
        }
        return readSummaries(server, base);
    }

    private BandwidthReading readStreams(ServerSnapshot server, String base) {
        try {
            UpstreamResponse response = http.get(server, base + STREAMS_PATH, Budget.ENRICHMENT);
            if (!response.isOk()) {
                log.debug("Endpoint de streams SRS de {} respondio HTTP {}", server.hostname(), response.status());
                return BandwidthReading.unavailable();
            }
            JsonNode streams = locateStreams(mapper.readTree(response.body()));
            if (streams == null) {
                log.debug("La respuesta de streams SRS de {} no trae lista de streams", server.hostname());
                return BandwidthReading.unavailable();
            }

            double kbpsIn = 0;
            double kbpsOut = 0;
            long bytesIn = 0;
            long bytesOut = 0;
            for (JsonNode stream : streams) {
                JsonNode kbps = stream.path("kbps");
                if (JsonValues.present(kbps.path("recv_30s"))) kbpsIn += JsonValues.decimal(kbps.path("recv_30s"));
                if (JsonValues.present(kbps.path("send_30s"))) kbpsOut += JsonValues.decimal(kbps.path("send_30s"));

                JsonNode bytes = stream.path("bytes");
                if (JsonValues.present(bytes.path("recv"))) bytesIn += JsonValues.integer(bytes.path("recv"));
                if (JsonValues.present(bytes.path("send"))) bytesOut += JsonValues.integer(bytes.path("send"));
            }
            log.debug("{} streams en {}: in={}kbps out={}kbps", streams.size(), server.hostname(), kbpsIn, kbpsOut);
            return new BandwidthReading(
                    BandwidthReading.Source.STREAMS,
                    kbpsIn / KBPS_PER_MBPS,
                    kbpsOut / KBPS_PER_MBPS,
                    bytesIn,
                    bytesOut,
                    streams.size()
            );
        } catch (Exception ex) {
            log.debug("No se pudieron leer los streams de {}: {}", server.hostname(), ex.toString());
            return BandwidthReading.unavailable();
        }
    }

    private BandwidthReading readSummaries(ServerSnapshot server, String base) {
        try {
            UpstreamResponse response = http.get(server, base + SUMMARIES_PATH, Budget.ENRICHMENT);
            if (!response.isOk()) {
                log.debug("Endpoint de summaries SRS de {} respondio HTTP {}", server.hostname(), response.status());
                return BandwidthReading.unavailable();
            }
            JsonNode data = mapper.readTree(response.body()).path("data");
            if (!data.isObject()) {
                return BandwidthReading.unavailable();
            }

            JsonNode kbps = data.path("kbps");
            JsonNode bytes = data.path("bytes");
            return new BandwidthReading(
                    BandwidthReading.Source.SUMMARIES,
                    JsonValues.present(kbps.path("recv_30s")) ? JsonValues.decimal(kbps.path("recv_30s")) / KBPS_PER_MBPS : null,
                    JsonValues.present(kbps.path("send_30s")) ? JsonValues.decimal(kbps.path("send_30s")) / KBPS_PER_MBPS : null,
                    JsonValues.present(bytes.path("recv")) ? JsonValues.integer(bytes.path("recv")) : null,
                    JsonValues.present(bytes.path("send")) ? JsonValues.integer(bytes.path("send")) : null,
                    null
            );
        } catch (Exception ex) {
            log.debug("No se pudo leer el respaldo summaries de {}: {}", server.hostname(), ex.toString());
            return BandwidthReading.unavailable();
        }
    }

    /**
     * Acepta {"streams": [...]}, un array suelto o {"data": {"streams": [...]}}.
     */
    static JsonNode locateStreams(JsonNode root) {
        if (root == null) return null;
        JsonNode candidate;
        if (root.isObject() && root.has("streams")) {
            candidate = root.get("streams");
        } else if (root.isArray()) {
            candidate = root;
        } else {
            candidate = root.path("data").path("streams");
        }
        return candidate != null && candidate.isArray() ? candidate : null;
    }
}
