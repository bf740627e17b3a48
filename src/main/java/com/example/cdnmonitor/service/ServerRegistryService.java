package com.example.cdnmonitor.service;

import com.example.cdnmonitor.model.dto.MetricSampleDto;
import com.example.cdnmonitor.model.dto.ProbeResult;
import com.example.cdnmonitor.model.dto.ServerDto;
import com.example.cdnmonitor.model.dto.ServerRegistrationRequest;
import com.example.cdnmonitor.model.dto.ServerSnapshot;
import com.example.cdnmonitor.model.entity.Server;
import com.example.cdnmonitor.repository.AlertRepository;
import com.example.cdnmonitor.repository.ServerMetricRepository;
import com.example.cdnmonitor.repository.ServerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Alta, edicion, baja y consulta de servidores para la API. No forma parte del ciclo de recoleccion.
 */
@Service
public class ServerRegistryService {

    private static final Logger log = LoggerFactory.getLogger(ServerRegistryService.class);

    static final Duration DEFAULT_METRICS_WINDOW = Duration.ofHours(24);
    // Un dia a cadencia de 5 minutos.
    static final int DEFAULT_METRICS_LIMIT = 288;
    static final int MAX_METRICS_LIMIT = 10_000;

    private final ServerRepository serverRepository;
    private final ServerMetricRepository metricRepository;
    private final AlertRepository alertRepository;
    private final ProbeService probeService;
    private final Clock clock;

    public ServerRegistryService(ServerRepository serverRepository,
                                 ServerMetricRepository metricRepository,
                                 AlertRepository alertRepository,
                                 ProbeService probeService,
                                 Clock clock) {
        this.serverRepository = serverRepository;
        this.metricRepository = metricRepository;
        this.alertRepository = alertRepository;
        this.probeService = probeService;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<ServerDto> list() {
        return serverRepository.findAllByOrderByHostnameAsc().stream()
                .map(s -> ServerDto.from(s, latestMetric(s.getId())))
                .toList();
    }

    @Transactional(readOnly = true)
    public ServerDto get(Long id) {
        Server server = find(id);
        return ServerDto.from(server, latestMetric(id));
    }

    /**
     * Da de alta el servidor y lo comprueba en el acto para que no quede en unknown hasta el siguiente ciclo.
     */
    public ServerDto register(ServerRegistrationRequest req) {
        String hostname = req.hostname().trim();
        if (serverRepository.existsByHostname(hostname)) {
            throw new DuplicateServerException(hostname);
        }

        Server server = new Server();
        applyConnection(server, req);
        server.setApiToken(blankToNull(req.apiToken()));
        server.setApiUsername(blankToNull(req.apiUsername()));
        server.setApiPassword(emptyToNull(req.apiPassword()));

        Server saved = saveUnique(server, hostname);
        log.info("Servidor registrado: {} ({})", saved.getHostname(), saved.getRole().code());
        return checkNow(saved);
    }

    /**
     * Edita los datos de conexion. Las credenciales solo cambian si vienen en la peticion.
     */
    public ServerDto update(Long id, ServerRegistrationRequest req) {
        Server server = find(id);
        String hostname = req.hostname().trim();
        if (serverRepository.existsByHostnameAndIdNot(hostname, id)) {
            throw new DuplicateServerException(hostname);
        }

        applyConnection(server, req);
        if (req.apiToken() != null) server.setApiToken(blankToNull(req.apiToken()));
        if (req.apiUsername() != null) server.setApiUsername(blankToNull(req.apiUsername()));
        if (req.apiPassword() != null) server.setApiPassword(emptyToNull(req.apiPassword()));

        Server saved = saveUnique(server, hostname);
        log.info("Servidor actualizado: {} ({})", saved.getHostname(), saved.getRole().code());
        return checkNow(saved);
    }

    /**
     * Borra el servidor junto con sus metricas y alertas, con borrados masivos.
     */
    @Transactional
    public void delete(Long id) {
        Server server = find(id);
        int alerts = alertRepository.deleteByServerId(id);
        int metrics = metricRepository.deleteByServerId(id);
        serverRepository.delete(server);
        log.info("Servidor eliminado: {} ({} metricas, {} alertas)", server.getHostname(), metrics, alerts);
    }

    /**
     * Sonda de conectividad bajo demanda; persiste el estado igual que el ciclo.
     */
    public ProbeResult testConnectivity(Long id) {
        ServerSnapshot snapshot = serverRepository.findById(id)
                .map(ServerSnapshot::from)
                .orElseThrow(() -> notFound(id));
        return probeService.probe(snapshot);
    }

    @Transactional(readOnly = true)
    public List<MetricSampleDto> metrics(Long id, Instant since, Instant until, Integer limit) {
        find(id);
        Instant to = until == null ? Instant.now(clock) : until;
        Instant from = since == null ? to.minus(DEFAULT_METRICS_WINDOW) : since;
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("'since' debe ser anterior a 'until'");
        }
        int safeLimit = limit == null || limit <= 0 ? DEFAULT_METRICS_LIMIT : Math.min(limit, MAX_METRICS_LIMIT);
        return metricRepository.findWindow(id, from, to, PageRequest.of(0, safeLimit)).stream()
                .map(m -> MetricSampleDto.from(m, id))
                .toList();
    }

    private MetricSampleDto latestMetric(Long serverId) {
        return metricRepository.findFirstByServer_IdOrderByTimestampDesc(serverId)
                .map(m -> MetricSampleDto.from(m, serverId))
                .orElse(null);
    }

    private Server find(Long id) {
        return serverRepository.findById(id).orElseThrow(() -> notFound(id));
    }

    private static NoSuchElementException notFound(Long id) {
        return new NoSuchElementException("Servidor no encontrado: " + id);
    }

    private static void applyConnection(Server server, ServerRegistrationRequest req) {
        server.setHostname(req.hostname().trim());
        server.setIpAddress(req.ipAddress().trim());
        server.setPort(req.port() == null ? 80 : req.port());
        server.setRole(req.role());
        server.setApiEndpoint(blankToNull(req.apiEndpoint()));
        server.setApiType(req.apiType() == null ? Server.ApiType.SRS : req.apiType());
    }

    private Server saveUnique(Server server, String hostname) {
        try {
            return serverRepository.saveAndFlush(server);
        } catch (DataIntegrityViolationException ex) {
            throw new DuplicateServerException(hostname);
        }
    }

    /**
     * Un fallo aqui no deshace el alta ni la edicion: el ciclo volvera a comprobarlo.
     */
    private ServerDto checkNow(Server saved) {
        try {
            ProbeResult result = probeService.probe(ServerSnapshot.from(saved));
            saved.setStatus(result.status());
        } catch (Exception ex) {
            log.warn("No se pudo comprobar {} tras guardarlo: {}", saved.getHostname(), ex.toString());
        }
        return ServerDto.from(saved, latestMetric(saved.getId()));
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
