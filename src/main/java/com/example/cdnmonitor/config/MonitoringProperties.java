package com.example.cdnmonitor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuracion del ciclo de recoleccion de metricas y de los umbrales de alerta.
 */
@ConfigurationProperties(prefix = "monitoring")
public class MonitoringProperties {

    /**
     * Si false, el planificador no arranca con el contexto.
     */
    private boolean enabled = true;

    /**
     * Pausa entre el final de un ciclo y el comienzo del siguiente.
     */
    private long intervalMs = 300_000;

    /**
     * Retardo del primer ciclo tras el arranque.
     */
    private long initialDelayMs = 0;

    /**
     * Timeout de la sonda de conectividad y de la peticion principal de metricas.
     */
    private long probeTimeoutMs = 10_000;

    /**
     * Timeout de las peticiones secundarias de ancho de banda (streams, summaries).
     */
    private long enrichmentTimeoutMs = 5_000;

    /**
     * Maximo de servidores sondeados en paralelo dentro de un ciclo.
     */
    private int maxParallelProbes = 8;

    /**
     * Tiempo que stop() espera a que termine el ciclo en curso.
     */
    private long shutdownTimeoutMs = 60_000;

    private Thresholds thresholds = new Thresholds();

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public long getIntervalMs() { return intervalMs; }
    public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }

    public long getInitialDelayMs() { return initialDelayMs; }
    public void setInitialDelayMs(long initialDelayMs) { this.initialDelayMs = initialDelayMs; }

    public long getProbeTimeoutMs() { return probeTimeoutMs; }
    public void setProbeTimeoutMs(long probeTimeoutMs) { this.probeTimeoutMs = probeTimeoutMs; }

    public long getEnrichmentTimeoutMs() { return enrichmentTimeoutMs; }
    public void setEnrichmentTimeoutMs(long enrichmentTimeoutMs) { this.enrichmentTimeoutMs = enrichmentTimeoutMs; }

    public int getMaxParallelProbes() { return maxParallelProbes; }
    public void setMaxParallelProbes(int maxParallelProbes) { this.maxParallelProbes = maxParallelProbes; }

    public long getShutdownTimeoutMs() { return shutdownTimeoutMs; }
    public void setShutdownTimeoutMs(long shutdownTimeoutMs) { this.shutdownTimeoutMs = shutdownTimeoutMs; }

    public Thresholds getThresholds() { return thresholds; }
    public void setThresholds(Thresholds thresholds) { this.thresholds = thresholds; }

    public static class Thresholds {
        private double cpuPercent = 80.0;
        private double memoryPercent = 85.0;
        private double responseTimeMs = 5_000.0;

        public double getCpuPercent() { return cpuPercent; }
        public void setCpuPercent(double cpuPercent) { this.cpuPercent = cpuPercent; }

        public double getMemoryPercent() { return memoryPercent; }
        public void setMemoryPercent(double memoryPercent) { this.memoryPercent = memoryPercent; }

        public double getResponseTimeMs() { return responseTimeMs; }
        public void setResponseTimeMs(double responseTimeMs) { this.responseTimeMs = responseTimeMs; }
    }
}
