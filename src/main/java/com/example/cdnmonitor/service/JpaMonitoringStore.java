package com.example.cdnmonitor.service;

import com.example.cdnmonitor.model.dto.CycleBatch;
import com.example.cdnmonitor.model.dto.MetricReading;
import com.example.cdnmonitor.model.dto.MetricSample;
import com.example.cdnmonitor.model.dto.NewAlert;
import com.example.cdnmonitor.model.dto.ServerSnapshot;
import com.example.cdnmonitor.model.entity.Alert;
import com.example.cdnmonitor.model.entity.Server;
import com.example.cdnmonitor.model.entity.ServerMetric;
import com.example.cdnmonitor.repository.AlertRepository;
import com.example.cdnmonitor.repository.ServerMetricRepository;
import com.example.cdnmonitor.repository.ServerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Service
public class JpaMonitoringStore implements MonitoringStore {

    private static final Logger log = LoggerFactory.getLogger(JpaMonitoringStore.class);

    private final ServerRepository serverRepository;
    private final ServerMetricRepository metricRepository;
    private final AlertRepository alertRepository;

    public JpaMonitoringStore(ServerRepository serverRepository,
                              ServerMetricRepository metricRepository,
                              AlertRepository alertRepository) {
        this.serverRepository = serverRepository;
        this.metricRepository = metricRepository;
        this.alertRepository = alertRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public List<ServerSnapshot> listServers() {
        return serverRepository.findAllByOrderByHostnameAsc().stream()
                .map(ServerSnapshot::from)
                .toList();
    }

    @Override
    @Transactional
    public Server.Status updateServerStatus(Long serverId, Server.Status status) {
        Server.Status previous = serverRepository.findStatusById(serverId).orElse(null);
        int updated = serverRepository.updateStatus(serverId, status, Instant.now());
        if (updated == 0) {
            log.warn("Estado no actualizado: el servidor {} ya no existe", serverId);
            return null;
        }
        return previous;
    }

    @Override
    @Transactional
    public void appendMetric(MetricSample sample) {
        metricRepository.save(toEntity(sample));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<OpenAlert> findUnacknowledgedAlert(Long serverId, Alert.Type type) {
        return alertRepository.findFirstByServer_IdAndAlertTypeAndAcknowledgedFalse(serverId, type)
                .map(a -> new OpenAlert(a.getId(), serverId, a.getAlertType()));
    }

    @Override
    @Transactional
    public void insertAlert(NewAlert alert) {
        alertRepository.save(toEntity(alert));
    }

    @Override
    @Transactional
    public List<NewAlert> commit(CycleBatch batch) {
        if (batch.isEmpty()) return List.of();

        List<ServerMetric> metrics = new ArrayList<>(batch.samples().size());
        for (MetricSample sample : batch.samples()) {
            if (serverRepository.existsById(sample.serverId())) {
                metrics.add(toEntity(sample));
            } else {
                log.warn("Muestra descartada: el servidor {} se elimino durante el ciclo", sample.serverId());
            }
        }
        metricRepository.saveAll(metrics);

        List<NewAlert> inserted = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (NewAlert alert : batch.alerts()) {
            String key = alert.serverId() + "|" + alert.type();
            if (!seen.add(key)) continue;
            if (!serverRepository.existsById(alert.serverId())) continue;
            if (alertRepository.countByServer_IdAndAlertTypeAndAcknowledgedFalse(alert.serverId(), alert.type()) > 0) {
                log.debug("Alerta {} omitida para el servidor {}: ya hay una sin reconocer", alert.type(), alert.serverId());
                continue;
            }
            alertRepository.save(toEntity(alert));
            inserted.add(alert);
        }
        return inserted;
    }

    private ServerMetric toEntity(MetricSample sample) {
        MetricReading r = sample.reading();
        ServerMetric m = new ServerMetric();
        m.setServer(serverRepository.getReferenceById(sample.serverId()));
        m.setTimestamp(sample.timestamp());
        m.setCpuUsage(r.cpuUsage());
        m.setMemoryUsage(r.memoryUsage());
        m.setMemoryTotal(r.memoryTotal());
        m.setMemoryUsed(r.memoryUsed());
        m.setActiveConnections(orZero(r.activeConnections()));
        m.setHlsConnections(orZero(r.hlsConnections()));
        m.setBytesSent(r.bytesSent() == null ? 0L : r.bytesSent());
        m.setBytesReceived(r.bytesReceived() == null ? 0L : r.bytesReceived());
        m.setBandwidthIn(r.bandwidthIn() == null ? 0.0 : r.bandwidthIn());
        m.setBandwidthOut(r.bandwidthOut() == null ? 0.0 : r.bandwidthOut());
        m.setStreamCount(orZero(r.streamCount()));
        m.setUptime(r.uptime());
        m.setResponseTime(r.responseTime());
        m.setErrorCount(r.errorCount());
        return m;
    }

    private Alert toEntity(NewAlert alert) {
        Alert a = new Alert();
        a.setServer(serverRepository.getReferenceById(alert.serverId()));
        a.setAlertType(alert.type());
        a.setSeverity(alert.severity());
        a.setMessage(alert.message());
        if (alert.createdAt() != null) {
            a.setCreatedAt(alert.createdAt());
        }
        return a;
    }

    private static int orZero(Integer value) {
        return value == null ? 0 : value;
    }
}
