package com.example.cdnmonitor.service;

import com.example.cdnmonitor.model.dto.ProbeResult;
import com.example.cdnmonitor.model.dto.ServerSnapshot;
import com.example.cdnmonitor.model.entity.Server;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Sonda de conectividad. Persiste el estado resultante en la misma llamada,
 * para que quede registrado aunque fallen las fases siguientes del ciclo.
 * La transicion a down se notifica aqui, al persistirla, tanto desde el ciclo
 * como desde la prueba manual.
 */
@Service
public class ProbeService {

    private static final Logger log = LoggerFactory.getLogger(ProbeService.class);

    private final UpstreamHttpClient http;
    private final MonitoringStore store;
    private final AlertNotifier notifier;

    public ProbeService(UpstreamHttpClient http, MonitoringStore store, AlertNotifier notifier) {
        this.http = http;
        this.store = store;
        this.notifier = notifier;
    }

    public ProbeResult probe(ServerSnapshot server) {
        ProbeResult result = check(server);
        Server.Status previous = store.updateServerStatus(server.id(), result.status());
        if (result.status() == Server.Status.DOWN && previous != null && previous != Server.Status.DOWN) {
            notifyDown(server.withStatus(Server.Status.DOWN));
        }
        return result;
    }

    private void notifyDown(ServerSnapshot server) {
        try {
            notifier.serverDown(server);
        } catch (Exception ex) {
            log.warn("Notificacion fallida para {}: {}", server.hostname(), ex.toString());
        }
    }

    private ProbeResult check(ServerSnapshot server) {
        long start = System.nanoTime();
        try {
            UpstreamHttpClient.UpstreamResponse response =
                    http.get(server, server.probeUrl(), UpstreamHttpClient.Budget.PRIMARY);
            if (response.isOk()) {
                return ProbeResult.up(response.elapsedMs());
            }
            log.warn("Comprobacion de conectividad de {} respondio HTTP {}", server.hostname(), response.status());
            return ProbeResult.badStatus(response.elapsedMs(), response.status());
        } catch (UpstreamTransportException ex) {
            log.error("Fallo de conectividad con {}: {}", server.hostname(), ex.getMessage());
            return ProbeResult.transportError(elapsedMs(start), ex.getMessage());
        } catch (Exception ex) {
            log.error("Error inesperado comprobando {}: {}", server.hostname(), ex.toString(), ex);
            return ProbeResult.unexpectedError(elapsedMs(start), ex.toString());
        }
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
