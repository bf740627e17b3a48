package com.example.cdnmonitor.service;

import com.example.cdnmonitor.model.dto.AlertDto;
import com.example.cdnmonitor.model.entity.Alert;
import com.example.cdnmonitor.repository.AlertRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;

@Service
public class AlertService {

    static final int DEFAULT_LIMIT = 20;
    static final int MAX_LIMIT = 500;

    private final AlertRepository alertRepository;
    private final Clock clock;

    public AlertService(AlertRepository alertRepository, Clock clock) {
        this.alertRepository = alertRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<AlertDto> open(Integer limit) {
        int safeLimit = limit == null || limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        return alertRepository.findOpenWithServer(PageRequest.of(0, safeLimit)).stream()
                .map(AlertDto::from)
                .toList();
    }

    /**
     * Reconoce la alerta. A partir de aqui el evaluador puede volver a crear una del mismo tipo.
     * Reconocer dos veces no cambia la fecha original.
     */
    @Transactional
    public AlertDto acknowledge(Long id) {
        Alert alert = alertRepository.findById(id)
                .orElseThrow(() -> new NoSuchElementException("Alerta no encontrada: " + id));
        alert.acknowledge(Instant.now(clock));
        return AlertDto.from(alertRepository.save(alert));
    }
}
