package com.example.cdnmonitor.controller;

import com.example.cdnmonitor.model.dto.MetricSampleDto;
import com.example.cdnmonitor.model.dto.ProbeResult;
import com.example.cdnmonitor.model.dto.ServerDto;
import com.example.cdnmonitor.model.dto.ServerRegistrationRequest;
import com.example.cdnmonitor.service.ServerRegistryService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;

@RestController
@RequestMapping("/api/servers")
public class ServerApiController {

    private final ServerRegistryService registry;

    public ServerApiController(ServerRegistryService registry) {
        this.registry = registry;
    }

    @GetMapping
    public List<ServerDto> list() {
        return registry.list();
    }

    @GetMapping("/{id}")
    public ServerDto get(@PathVariable Long id) {
        return registry.get(id);
    }

    @PostMapping
    public ResponseEntity<ServerDto> register(@Valid @RequestBody ServerRegistrationRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(registry.register(req));
    }

    @PutMapping("/{id}")
    public ServerDto update(@PathVariable Long id, @Valid @RequestBody ServerRegistrationRequest req) {
        return registry.update(id, req);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        registry.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/test")
    public ProbeResult test(@PathVariable Long id) {
        return registry.testConnectivity(id);
    }

    @GetMapping("/{id}/metrics")
    public List<MetricSampleDto> metrics(
            @PathVariable Long id,
            @RequestParam(name = "since", required = false) String since,
            @RequestParam(name = "until", required = false) String until,
            @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return registry.metrics(id, parseInstant("since", since), parseInstant("until", until), limit);
    }

    private Instant parseInstant(String name, String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return Instant.parse(raw.trim());
        } catch (DateTimeParseException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Parametro '" + name + "' invalido. Usa ISO-8601.");
        }
    }
}
