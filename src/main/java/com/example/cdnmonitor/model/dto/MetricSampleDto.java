package com.example.cdnmonitor.model.dto;

import com.example.cdnmonitor.model.entity.ServerMetric;

import java.time.Instant;

public record MetricSampleDto(
        Long id,
        Long serverId,
        Instant timestamp,
        Double cpuUsage,
        Double memoryUsage,
        Long memoryTotal,
        Long memoryUsed,
        int activeConnections,
        int hlsConnections,
        long bytesSent,
        long bytesReceived,
        double bandwidthIn,
        double bandwidthOut,
        int streamCount,
        Long uptime,
        Double responseTime,
        int errorCount
) {

    public static MetricSampleDto from(ServerMetric m, Long serverId) {
        return new MetricSampleDto(
                m.getId(),
                serverId,
                m.getTimestamp(),
                m.getCpuUsage(),
                m.getMemoryUsage(),
                m.getMemoryTotal(),
                m.getMemoryUsed(),
                m.getActiveConnections(),
                m.getHlsConnections(),
                m.getBytesSent(),
                m.getBytesReceived(),
                m.getBandwidthIn(),
                m.getBandwidthOut(),
                m.getStreamCount(),
                m.getUptime(),
                m.getResponseTime(),
                m.getErrorCount()
        );
    }
}
