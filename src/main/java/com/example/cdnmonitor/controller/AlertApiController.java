package com.example.cdnmonitor.controller;

import com.example.cdnmonitor.model.dto.AlertDto;
import com.example.cdnmonitor.service.AlertService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/alerts")
public class AlertApiController {

    private final AlertService alertService;

    public AlertApiController(AlertService alertService) {
        this.alertService = alertService;
    }

    @GetMapping
    public List<AlertDto> open(@RequestParam(name = "limit", required = false) Integer limit) {
        return alertService.open(limit);
    }

    @PostMapping("/{id}/acknowledge")
    public AlertDto acknowledge(@PathVariable Long id) {
        return alertService.acknowledge(id);
    }
}
