package com.example.cdnmonitor.model.dto;

/**
 * Forma canonica de las metricas de un servidor, comun a todos los dialectos.
 * Los campos nulos significan "no informado".
 */
public record MetricReading(
        Integer activeConnections,
        Integer hlsConnections,
        Double cpuUsage,
        Double memoryUsage,
        Long memoryTotal,
        Long memoryUsed,
        Long bytesSent,
        Long bytesReceived,
        Double bandwidthIn,
        Double bandwidthOut,
        Integer streamCount,
        Long uptime,
        Double responseTime,
        int errorCount
) {

    public static MetricReading empty() {
        return builder().build();
    }

    /**
     * Muestra minima para un servidor inalcanzable o cuyo pipeline fallo.
     */
    public static MetricReading failed() {
        return builder().activeConnections(0).hlsConnections(0).errorCount(1).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .activeConnections(activeConnections)
                .hlsConnections(hlsConnections)
                .cpuUsage(cpuUsage)
                .memoryUsage(memoryUsage)
                .memoryTotal(memoryTotal)
                .memoryUsed(memoryUsed)
                .bytesSent(bytesSent)
                .bytesReceived(bytesReceived)
                .bandwidthIn(bandwidthIn)
                .bandwidthOut(bandwidthOut)
                .streamCount(streamCount)
                .uptime(uptime)
                .responseTime(responseTime)
                .errorCount(errorCount);
    }

    public static final class Builder {
        private Integer activeConnections;
        private Integer hlsConnections;
        private Double cpuUsage;
        private Double memoryUsage;
        private Long memoryTotal;
        private Long memoryUsed;
        private Long bytesSent;
        private Long bytesReceived;
        private Double bandwidthIn;
        private Double bandwidthOut;
        private Integer streamCount;
        private Long uptime;
        private Double responseTime;
        private int errorCount;

        private Builder() {
        }

        public Builder activeConnections(Integer v) { this.activeConnections = v; return this; }
        public Builder hlsConnections(Integer v) { this.hlsConnections = v; return this; }
        public Builder cpuUsage(Double v) { this.cpuUsage = v; return this; }
        public Builder memoryUsage(Double v) { this.memoryUsage = v; return this; }
        public Builder memoryTotal(Long v) { this.memoryTotal = v; return this; }
        public Builder memoryUsed(Long v) { this.memoryUsed = v; return this; }
        public Builder bytesSent(Long v) { this.bytesSent = v; return this; }
        public Builder bytesReceived(Long v) { this.bytesReceived = v; return this; }
        public Builder bandwidthIn(Double v) { this.bandwidthIn = v; return this; }
        public Builder bandwidthOut(Double v) { this.bandwidthOut = v; return this; }
        public Builder streamCount(Integer v) { this.streamCount = v; return this; }
        public Builder uptime(Long v) { this.uptime = v; return this; }
        public Builder responseTime(Double v) { this.responseTime = v; return this; }
        public Builder errorCount(int v) { this.errorCount = v; return this; }

        public Builder bandwidth(BandwidthReading reading) {
            if (reading == null || !reading.isAvailable()) return this;
            this.bandwidthIn = reading.bandwidthInMbps();
            this.bandwidthOut = reading.bandwidthOutMbps();
            this.bytesReceived = reading.bytesReceived();
            this.bytesSent = reading.bytesSent();
            this.streamCount = reading.streamCount();
            return this;
        }

        public MetricReading build() {
            return new MetricReading(activeConnections, hlsConnections, cpuUsage, memoryUsage, memoryTotal,
                    memoryUsed, bytesSent, bytesReceived, bandwidthIn, bandwidthOut, streamCount, uptime,
                    responseTime, errorCount);
        }
    }
}
