package com.example.cdnmonitor.service;

import com.example.cdnmonitor.model.dto.DashboardStatsDto;
import com.example.cdnmonitor.model.entity.Server;
import com.example.cdnmonitor.repository.ServerMetricRepository;
import com.example.cdnmonitor.repository.ServerRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class DashboardService {

    private final ServerRepository serverRepository;
    private final ServerMetricRepository metricRepository;

    public DashboardService(ServerRepository serverRepository, ServerMetricRepository metricRepository) {
        this.serverRepository = serverRepository;
        this.metricRepository = metricRepository;
    }

    @Transactional(readOnly = true)
    public DashboardStatsDto stats() {
        List<Server> servers = serverRepository.findAll();

        Map<String, Integer> statusCounts = new LinkedHashMap<>();
        for (Server.Status status : Server.Status.values()) {
            statusCounts.put(status.code(), 0);
        }
        Map<String, Integer> roleCounts = new LinkedHashMap<>();
        for (Server.Role role : Server.Role.values()) {
            roleCounts.put(role.code(), 0);
        }

        long totalConnections = 0;
        for (Server server : servers) {
            if (server.getStatus() != null) statusCounts.merge(server.getStatus().code(), 1, Integer::sum);
            if (server.getRole() != null) roleCounts.merge(server.getRole().code(), 1, Integer::sum);
            totalConnections += metricRepository.findFirstByServer_IdOrderByTimestampDesc(server.getId())
                    .map(m -> (long) m.getActiveConnections())
                    .orElse(0L);
        }
        return new DashboardStatsDto(servers.size(), statusCounts, roleCounts, totalConnections);
    }
}
