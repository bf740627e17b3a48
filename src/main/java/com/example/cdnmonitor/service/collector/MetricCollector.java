package com.example.cdnmonitor.service.collector;

import com.example.cdnmonitor.model.dto.MetricReading;
import com.example.cdnmonitor.model.dto.ServerSnapshot;
import com.example.cdnmonitor.model.entity.Server;

/**
 * Lector de metricas para un dialecto de API concreto.
 * Las implementaciones no lanzan: un fallo de transporte o de parseo se
 * devuelve como lectura con {@code errorCount = 1}.
 */
public interface MetricCollector {

    Server.ApiType dialect();

    MetricReading collect(ServerSnapshot server);
}
