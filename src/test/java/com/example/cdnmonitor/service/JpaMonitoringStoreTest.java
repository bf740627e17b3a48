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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(JpaMonitoringStore.class)
class JpaMonitoringStoreTest {

    @Autowired
    private JpaMonitoringStore store;

    @Autowired
    private TestEntityManager em;

    @Autowired
    private ServerRepository serverRepository;

    @Autowired
    private ServerMetricRepository metricRepository;

    @Autowired
    private AlertRepository alertRepository;

    private Server origin;

    @BeforeEach
    void setUp() {
        origin = persistServer("origin-1", Server.Role.ORIGIN);
        persistServer("edge-1", Server.Role.EDGE);
        em.flush();
    }

    private Server persistServer(String hostname, Server.Role role) {
        Server s = new Server();
        s.setHostname(hostname);
        s.setIpAddress("10.0.0.1");
        s.setPort(1985);
        s.setRole(role);
        s.setApiEndpoint("http://" + hostname + ":1985");
        s.setApiType(Server.ApiType.SRS);
        return em.persist(s);
    }

    private NewAlert cpuAlert(Long serverId) {
        return new NewAlert(serverId, "origin-1", Alert.Type.CPU_HIGH, Alert.Severity.WARNING,
                "High CPU usage on origin-1: 95.0%", Instant.now());
    }

    @Test
    void listsServersOrderedByHostname() {
        List<ServerSnapshot> servers = store.listServers();

        assertThat(servers).extracting(ServerSnapshot::hostname).containsExactly("edge-1", "origin-1");
        assertThat(servers.get(1).status()).isEqualTo(Server.Status.UNKNOWN);
    }

    @Test
    void updatesStatusAndTimestamp() {
        Instant before = origin.getUpdatedAt();

        Server.Status previous = store.updateServerStatus(origin.getId(), Server.Status.DOWN);
        em.clear();

        assertThat(previous).isEqualTo(Server.Status.UNKNOWN);

        Server reloaded = serverRepository.findById(origin.getId()).orElseThrow();
        assertThat(reloaded.getStatus()).isEqualTo(Server.Status.DOWN);
        assertThat(reloaded.getUpdatedAt()).isAfterOrEqualTo(before);
    }

    @Test
    void updatingAMissingServerIsIgnored() {
        assertThat(store.updateServerStatus(999_999L, Server.Status.UP)).isNull();
        assertThat(serverRepository.count()).isEqualTo(2);
    }

    @Test
    void commitStoresSamplesWithDefaultsForMissingCounters() {
        MetricReading reading = MetricReading.builder().cpuUsage(42.5).activeConnections(12).build();

        store.commit(new CycleBatch(List.of(new MetricSample(origin.getId(), Instant.now(), reading)), List.of()));
        em.flush();
        em.clear();

        ServerMetric m = metricRepository.findFirstByServer_IdOrderByTimestampDesc(origin.getId()).orElseThrow();
        assertThat(m.getCpuUsage()).isEqualTo(42.5);
        assertThat(m.getActiveConnections()).isEqualTo(12);
        assertThat(m.getHlsConnections()).isZero();
        assertThat(m.getBandwidthIn()).isZero();
        assertThat(m.getMemoryUsage()).isNull();
        assertThat(m.getErrorCount()).isZero();
    }

    @Test
    void appendMetricWritesASingleSample() {
        store.appendMetric(new MetricSample(origin.getId(), Instant.now(), MetricReading.failed()));
        em.flush();

        assertThat(metricRepository.countByServer_Id(origin.getId())).isEqualTo(1);
        assertThat(metricRepository.findFirstByServer_IdOrderByTimestampDesc(origin.getId()).orElseThrow().getErrorCount())
                .isEqualTo(1);
    }

    @Test
    void commitSkipsAlertWhenOneIsAlreadyOpen() {
        store.insertAlert(cpuAlert(origin.getId()));
        em.flush();

        List<NewAlert> inserted = store.commit(new CycleBatch(List.of(), List.of(cpuAlert(origin.getId()))));

        assertThat(inserted).isEmpty();
        assertThat(alertRepository.countByServer_IdAndAlertTypeAndAcknowledgedFalse(origin.getId(), Alert.Type.CPU_HIGH))
                .isEqualTo(1);
    }

    @Test
    void commitCollapsesDuplicatesWithinTheSameBatch() {
        List<NewAlert> inserted = store.commit(new CycleBatch(List.of(),
                List.of(cpuAlert(origin.getId()), cpuAlert(origin.getId()))));

        assertThat(inserted).hasSize(1);
        assertThat(alertRepository.countByServer_Id(origin.getId())).isEqualTo(1);
    }

    @Test
    void acknowledgedAlertDoesNotBlockANewOne() {
        store.insertAlert(cpuAlert(origin.getId()));
        em.flush();
        Alert open = alertRepository.findFirstByServer_IdAndAlertTypeAndAcknowledgedFalse(origin.getId(), Alert.Type.CPU_HIGH)
                .orElseThrow();
        open.acknowledge(Instant.now());
        em.flush();

        assertThat(store.findUnacknowledgedAlert(origin.getId(), Alert.Type.CPU_HIGH)).isEmpty();
        List<NewAlert> inserted = store.commit(new CycleBatch(List.of(), List.of(cpuAlert(origin.getId()))));

        assertThat(inserted).hasSize(1);
        assertThat(alertRepository.countByServer_Id(origin.getId())).isEqualTo(2);
    }

    @Test
    void commitDropsDataForServersDeletedMidCycle() {
        long missing = 999_999L;
        MetricSample orphan = new MetricSample(missing, Instant.now(), MetricReading.failed());
        MetricSample kept = new MetricSample(origin.getId(), Instant.now(), MetricReading.empty());

        List<NewAlert> inserted = store.commit(new CycleBatch(List.of(orphan, kept), List.of(cpuAlert(missing))));

        assertThat(inserted).isEmpty();
        assertThat(metricRepository.count()).isEqualTo(1);
        assertThat(alertRepository.count()).isZero();
    }

    @Test
    void bulkDeletesClearMetricsAndAlertsOfOneServer() {
        Server edge = serverRepository.findAllByOrderByHostnameAsc().get(0);
        for (int i = 0; i < 50; i++) {
            store.appendMetric(new MetricSample(origin.getId(), Instant.now().minusSeconds(i), MetricReading.empty()));
        }
        store.appendMetric(new MetricSample(edge.getId(), Instant.now(), MetricReading.empty()));
        store.insertAlert(cpuAlert(origin.getId()));
        em.flush();
        em.clear();

        assertThat(alertRepository.deleteByServerId(origin.getId())).isEqualTo(1);
        assertThat(metricRepository.deleteByServerId(origin.getId())).isEqualTo(50);
        serverRepository.deleteById(origin.getId());
        em.flush();

        assertThat(metricRepository.countByServer_Id(origin.getId())).isZero();
        assertThat(alertRepository.countByServer_Id(origin.getId())).isZero();
        assertThat(metricRepository.countByServer_Id(edge.getId())).isEqualTo(1);
        assertThat(serverRepository.count()).isEqualTo(1);
    }
}
