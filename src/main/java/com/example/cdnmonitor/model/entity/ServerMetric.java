package com.example.cdnmonitor.model.entity;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * Muestra puntual de un servidor. Se escribe una vez por ciclo y no se modifica.
 */
@Entity
@Table(name = "server_metric", indexes = {
        @Index(name = "idx_server_metric_server_ts", columnList = "server_id, timestamp")
})
public class ServerMetric {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "server_id", nullable = false)
    private Server server;

    @Column(nullable = false)
    private Instant timestamp;

    @Column(name = "cpu_usage")
    private Double cpuUsage;

    @Column(name = "memory_usage")
    private Double memoryUsage;

    @Column(name = "memory_total")
    private Long memoryTotal;

    @Column(name = "memory_used")
    private Long memoryUsed;

    @Column(name = "active_connections", nullable = false)
    private int activeConnections;

    @Column(name = "hls_connections", nullable = false)
    private int hlsConnections;

    @Column(name = "bytes_sent", nullable = false)
    private long bytesSent;

    @Column(name = "bytes_received", nullable = false)
    private long bytesReceived;

    @Column(name = "bandwidth_in", nullable = false)
    private double bandwidthIn;

    @Column(name = "bandwidth_out", nullable = false)
    private double bandwidthOut;

    @Column(name = "stream_count", nullable = false)
    private int streamCount;

    private Long uptime;

    @Column(name = "response_time")
    private Double responseTime;

    @Column(name = "error_count", nullable = false)
    private int errorCount;

    public Long getId() { return id; }

    public Server getServer() { return server; }
    public void setServer(Server server) { this.server = server; }

    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }

    public Double getCpuUsage() { return cpuUsage; }
    public void setCpuUsage(Double cpuUsage) { this.cpuUsage = cpuUsage; }

    public Double getMemoryUsage() { return memoryUsage; }
    public void setMemoryUsage(Double memoryUsage) { this.memoryUsage = memoryUsage; }

    public Long getMemoryTotal() { return memoryTotal; }
    public void setMemoryTotal(Long memoryTotal) { this.memoryTotal = memoryTotal; }

    public Long getMemoryUsed() { return memoryUsed; }
    public void setMemoryUsed(Long memoryUsed) { this.memoryUsed = memoryUsed; }

    public int getActiveConnections() { return activeConnections; }
    public void setActiveConnections(int activeConnections) { this.activeConnections = activeConnections; }

    public int getHlsConnections() { return hlsConnections; }
    public void setHlsConnections(int hlsConnections) { this.hlsConnections = hlsConnections; }

    public long getBytesSent() { return bytesSent; }
    public void setBytesSent(long bytesSent) { this.bytesSent = bytesSent; }

    public long getBytesReceived() { return bytesReceived; }
    public void setBytesReceived(long bytesReceived) { this.bytesReceived = bytesReceived; }

    public double getBandwidthIn() { return bandwidthIn; }
    public void setBandwidthIn(double bandwidthIn) { this.bandwidthIn = bandwidthIn; }

    public double getBandwidthOut() { return bandwidthOut; }
    public void setBandwidthOut(double bandwidthOut) { this.bandwidthOut = bandwidthOut; }

    public int getStreamCount() { return streamCount; }
    public void setStreamCount(int streamCount) { this.streamCount = streamCount; }

    public Long getUptime() { return uptime; }
    public void setUptime(Long uptime) { this.uptime = uptime; }

    public Double getResponseTime() { return responseTime; }
    public void setResponseTime(Double responseTime) { this.responseTime = responseTime; }

    public int getErrorCount() { return errorCount; }
    public void setErrorCount(int errorCount) { this.errorCount = errorCount; }
}
