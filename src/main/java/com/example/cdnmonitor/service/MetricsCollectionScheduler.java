package com.example.cdnmonitor.service;

import com.example.cdnmonitor.config.MonitoringProperties;
import com.example.cdnmonitor.model.dto.CycleReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Lanza un ciclo al arrancar y despues cada {@code monitoring.interval-ms}, contado desde el
 * final del ciclo anterior: un ciclo largo retrasa el siguiente, nunca lo duplica.
 * {@link #stop()} espera a que termine el ciclo en curso. Se puede volver a arrancar.
 */
@Component
public class MetricsCollectionScheduler implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(MetricsCollectionScheduler.class);

    private final MetricsCollectionService collectionService;
    private final MonitoringProperties props;

    private final Object monitor = new Object();
    private ScheduledExecutorService executor;

    private volatile CycleReport lastReport;

    public MetricsCollectionScheduler(MetricsCollectionService collectionService, MonitoringProperties props) {
        this.collectionService = collectionService;
        this.props = props;
    }

    @Override
    public void start() {
        synchronized (monitor) {
            if (executor != null) return;
            executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread t = new Thread(runnable, "metrics-scheduler");
                t.setDaemon(true);
                return t;
            });
            executor.scheduleWithFixedDelay(
                    this::runCycleSafely,
                    Math.max(0, props.getInitialDelayMs()),
                    Math.max(1, props.getIntervalMs()),
                    TimeUnit.MILLISECONDS
            );
        }
        log.info("Monitorizacion en segundo plano iniciada (intervalo {} ms)", props.getIntervalMs());
    }

    @Override
    public void stop() {
        ScheduledExecutorService current;
        synchronized (monitor) {
            current = executor;
            executor = null;
        }
        if (current == null) return;

        // shutdown() cancela los ciclos pendientes y deja terminar el que esta en marcha.
        current.shutdown();
        try {
            if (!current.awaitTermination(props.getShutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                log.warn("El ciclo en curso no termino en {} ms; se interrumpe", props.getShutdownTimeoutMs());
                current.shutdownNow();
            }
        } catch (InterruptedException ex) {
            current.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Monitorizacion en segundo plano detenida");
    }

    @Override
    public boolean isRunning() {
        synchronized (monitor) {
            return executor != null;
        }
    }

    @Override
    public boolean isAutoStartup() {
        return props.isEnabled();
    }

    public CycleReport getLastReport() {
        return lastReport;
    }

    private void runCycleSafely() {
        // Una excepcion aqui cancelaria las ejecuciones periodicas siguientes.
        try {
            lastReport = collectionService.runCycle();
        } catch (Exception ex) {
            log.error("Fallo inesperado en el ciclo de recoleccion", ex);
        }
    }
}
