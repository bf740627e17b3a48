package com.example.cdnmonitor.service;

import com.example.cdnmonitor.model.dto.CycleBatch;
import com.example.cdnmonitor.model.dto.MetricSample;
import com.example.cdnmonitor.model.dto.NewAlert;
import com.example.cdnmonitor.model.dto.ServerSnapshot;
import com.example.cdnmonitor.model.entity.Alert;
import com.example.cdnmonitor.model.entity.Server;

import java.util.List;
import java.util.Optional;

/**
 * Almacen duradero que consume el motor de recoleccion. El motor solo habla con
 * esta interfaz, nunca con entidades gestionadas.
 */
public interface MonitoringStore {

    List<ServerSnapshot> listServers();

    /**
     * @return estado anterior, o null si el servidor ya no existe
     */
    Server.Status updateServerStatus(Long serverId, Server.Status status);

    void appendMetric(MetricSample sample);

    Optional<OpenAlert> findUnacknowledgedAlert(Long serverId, Alert.Type type);

    void insertAlert(NewAlert alert);

    /**
     * Confirma atomicamente las escrituras de un ciclo. Las alertas que ya tengan una abierta
     * del mismo (servidor, tipo) en el momento de confirmar se descartan.
     *
     * @return alertas efectivamente insertadas
     * @throws org.springframework.dao.DataAccessException si la transaccion falla; no se escribe nada
     */
    List<NewAlert> commit(CycleBatch batch);

    /**
     * Alerta sin reconocer, tal como la necesita la deduplicacion.
     */
    record OpenAlert(Long id, Long serverId, Alert.Type type) {}
}
