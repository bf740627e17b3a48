package com.example.cdnmonitor.service;

import com.example.cdnmonitor.config.MonitoringProperties;
import com.example.cdnmonitor.model.dto.CycleBatch;
import com.example.cdnmonitor.model.dto.CycleReport;
import com.example.cdnmonitor.model.dto.MetricReading;
import com.example.cdnmonitor.model.dto.MetricSample;
import com.example.cdnmonitor.model.dto.NewAlert;
import com.example.cdnmonitor.model.dto.ProbeResult;
import com.example.cdnmonitor.model.dto.ServerSnapshot;
import com.example.cdnmonitor.service.collector.MetricNormalizer;
import com.example.cdnmonitor.util.RequestIdHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Un ciclo de recoleccion: sonda, metricas, alertas y una unica confirmacion por ciclo.
 * Los fallos de un servidor no afectan a los demas y cada servidor deja exactamente
 * una muestra por ciclo, aunque sea la minima con {@code errorCount = 1}.
 */
@Service
public class MetricsCollectionService {

    private static final Logger log = LoggerFactory.getLogger(MetricsCollectionService.class);

    private final MonitoringStore store;
    private final ProbeService probeService;
    private final MetricNormalizer normalizer;
    private final AlertEvaluator evaluator;
    private final AlertNotifier notifier;
    private final MonitoringProperties props;
    private final Clock clock;

    // Los ciclos no se solapan aunque se lancen fuera del planificador.
    private final ReentrantLock cycleLock = new ReentrantLock();

    public MetricsCollectionService(MonitoringStore store,
                                    ProbeService probeService,
                                    MetricNormalizer normalizer,
                                    AlertEvaluator evaluator,
                                    AlertNotifier notifier,
                                    MonitoringProperties props,
                                    Clock clock) {
        this.store = store;
        this.probeService = probeService;
        this.normalizer = normalizer;
        this.evaluator = evaluator;
        this.notifier = notifier;
        this.props = props;
        this.clock = clock;
    }

    public CycleReport runCycle() {
        cycleLock.lock();
        String cycleId = RequestIdHolder.generateCycleId();
        try (var ignored = RequestIdHolder.use(cycleId)) {
            Instant startedAt = Instant.now(clock);

            List<ServerSnapshot> servers;
            try {
                servers = store.listServers();
            } catch (Exception ex) {
                log.error("No se pudo cargar la lista de servidores; ciclo omitido", ex);
                return new CycleReport(cycleId, startedAt, Instant.now(clock), 0, 0, 0, 0, false);
            }
            if (servers.isEmpty()) {
                log.debug("Sin servidores registrados");
                return new CycleReport(cycleId, startedAt, Instant.now(clock), 0, 0, 0, 0, true);
            }

            List<ServerOutcome> outcomes;
            try {
                outcomes = pollAll(servers, cycleId);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                log.warn("Ciclo interrumpido antes de terminar la recoleccion; no se guarda nada");
                return new CycleReport(cycleId, startedAt, Instant.now(clock), servers.size(), 0, 0, 0, false);
            }

            List<MetricSample> samples = new ArrayList<>(outcomes.size());
            List<NewAlert> pending = new ArrayList<>();
            for (ServerOutcome outcome : outcomes) {
                samples.add(outcome.sample());
                pending.addAll(outcome.alerts());
            }

            List<NewAlert> created;
            boolean committed;
            try {
                created = store.commit(new CycleBatch(samples, pending));
                committed = true;
            } catch (Exception ex) {
                log.error("Error guardando metricas del ciclo; lote descartado ({} muestras, {} alertas)",
                        samples.size(), pending.size(), ex);
                created = List.of();
                committed = false;
            }

            if (committed) {
                notifyAlerts(outcomes, created);
            }

            int reachable = (int) outcomes.stream().filter(ServerOutcome::reachable).count();
            CycleReport report = new CycleReport(
                    cycleId,
                    startedAt,
                    Instant.now(clock),
                    servers.size(),
                    reachable,
                    committed ? samples.size() : 0,
                    created.size(),
                    committed
            );
            log.info("Ciclo completado: servers={} reachable={} samples={} alerts={} committed={}",
                    report.serversPolled(), report.serversReachable(), report.samplesWritten(),
                    report.alertsCreated(), report.committed());
            return report;
        } finally {
            cycleLock.unlock();
        }
    }

    /**
     * @throws InterruptedException si se interrumpe la espera; el lote incompleto no debe confirmarse
     */
    private List<ServerOutcome> pollAll(List<ServerSnapshot> servers, String cycleId) throws InterruptedException {
        int workers = Math.max(1, Math.min(servers.size(), props.getMaxParallelProbes()));
        ExecutorService pool = Executors.newFixedThreadPool(workers, workerThreads());
        try {
            List<Future<ServerOutcome>> futures = new ArrayList<>(servers.size());
            for (ServerSnapshot server : servers) {
                futures.add(pool.submit(() -> {
                    try (var ignored = RequestIdHolder.use(cycleId)) {
                        return pollServer(server);
                    }
                }));
            }

            List<ServerOutcome> outcomes = new ArrayList<>(servers.size());
            for (int i = 0; i < servers.size(); i++) {
                ServerSnapshot server = servers.get(i);
                try {
                    outcomes.add(futures.get(i).get());
                } catch (ExecutionException ex) {
                    log.error("Error recolectando metricas de {}", server.hostname(), ex.getCause());
                    outcomes.add(failedOutcome(server));
                } catch (InterruptedException ex) {
                    log.warn("Ciclo interrumpido esperando a {}", server.hostname());
                    futures.forEach(f -> f.cancel(true));
                    throw ex;
                }
            }
            return outcomes;
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Pipeline de un servidor. No lanza.
     */
    ServerOutcome pollServer(ServerSnapshot server) {
        ServerSnapshot current = server;
        boolean reachable = false;
        MetricReading reading;
        try {
            ProbeResult probe = probeService.probe(server);
            current = server.withStatus(probe.status());
            reachable = probe.reachable();
            if (reachable) {
                reading = normalizer.collect(current);
                if (reading.responseTime() == null) {
                    reading = reading.toBuilder().responseTime(probe.latencyMs()).build();
                }
            } else {
                reading = MetricReading.failed();
            }
        } catch (Exception ex) {
            log.error("Error recolectando metricas de {}: {}", server.hostname(), ex.toString(), ex);
            reading = MetricReading.failed();
        }

        MetricSample sample = new MetricSample(server.id(), Instant.now(clock), reading);

        List<NewAlert> alerts;
        try {
            alerts = evaluator.evaluate(current, reading);
        } catch (Exception ex) {
            log.error("Error evaluando alertas de {}: {}", server.hostname(), ex.toString());
            alerts = List.of();
        }
        return new ServerOutcome(server, current, reachable, sample, alerts);
    }

    private ServerOutcome failedOutcome(ServerSnapshot server) {
        MetricSample sample = new MetricSample(server.id(), Instant.now(clock), MetricReading.failed());
        return new ServerOutcome(server, server, false, sample, List.of());
    }

    /**
     * Solo las alertas urgentes realmente insertadas. La caida del servidor la notifica la sonda.
     */
    private void notifyAlerts(List<ServerOutcome> outcomes, List<NewAlert> created) {
        Map<Long, ServerSnapshot> byId = outcomes.stream()
                .collect(Collectors.toMap(o -> o.before().id(), ServerOutcome::after, (a, b) -> a));

        for (NewAlert alert : created) {
            if (!alert.severity().isUrgent()) continue;
            ServerSnapshot server = byId.get(alert.serverId());
            if (server == null) continue;
            safeNotify(server, () -> notifier.alertRaised(server, alert));
        }
    }

    private void safeNotify(ServerSnapshot server, Runnable call) {
        try {
            call.run();
        } catch (Exception ex) {
            log.warn("Notificacion fallida para {}: {}", server.hostname(), ex.toString());
        }
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, "metrics-collector-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Resultado del pipeline de un servidor dentro de un ciclo.
     */
    record ServerOutcome(
            ServerSnapshot before,
            ServerSnapshot after,
            boolean reachable,
            MetricSample sample,
            List<NewAlert> alerts
    ) {}
}
