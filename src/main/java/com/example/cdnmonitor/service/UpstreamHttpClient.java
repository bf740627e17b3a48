package com.example.cdnmonitor.service;

import com.example.cdnmonitor.model.dto.ServerSnapshot;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;

/**
 * GET autenticado contra la API de un servidor monitorizado.
 * Nunca lanza por codigos HTTP: el llamante decide que hacer con un no-200.
 */
public class UpstreamHttpClient {

    /**
     * Presupuesto de tiempo de la peticion.
     */
    public enum Budget {
        /** Sonda de conectividad y peticion principal de metricas. */
        PRIMARY,
        /** Enriquecimiento best-effort (streams, summaries). */
        ENRICHMENT
    }

    private final RestClient primary;
    private final RestClient enrichment;

    public UpstreamHttpClient(RestClient primary, RestClient enrichment) {
        this.primary = primary;
        this.enrichment = enrichment;
    }

    /**
     * @throws UpstreamTransportException si la peticion no llega a obtener respuesta
     * @throws IllegalArgumentException   si la URL no es valida
     */
    public UpstreamResponse get(ServerSnapshot server, String url, Budget budget) {
        RestClient client = budget == Budget.ENRICHMENT ? enrichment : primary;
        URI target = URI.create(url);

        long start = System.nanoTime();
        try {
            return client.get()
                    .uri(target)
                    .headers(headers -> applyAuth(headers, server))
                    .exchange((request, response) -> {
                        int status = response.getStatusCode().value();
                        String body;
                        try (InputStream in = response.getBody()) {
                            body = StreamUtils.copyToString(in, StandardCharsets.UTF_8);
                        }
                        return new UpstreamResponse(status, body, elapsedMs(start));
                    });
        } catch (ResourceAccessException ex) {
            Throwable root = ex.getCause() == null ? ex : ex.getCause();
            String detail = root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
            throw new UpstreamTransportException(detail, ex);
        }
    }

    /**
     * Token bearer si existe; si no, basic auth con usuario y password; si no, sin autenticar.
     */
    static void applyAuth(HttpHeaders headers, ServerSnapshot server) {
        if (server.hasToken()) {
            headers.setBearerAuth(server.apiToken().trim());
        } else if (server.hasBasicCredentials()) {
            headers.setBasicAuth(server.apiUsername(), server.apiPassword(), StandardCharsets.UTF_8);
        }
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    public record UpstreamResponse(int status, String body, double elapsedMs) {

        public boolean isOk() {
            return status == 200;
        }
    }
}
