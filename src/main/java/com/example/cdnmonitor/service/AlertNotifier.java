package com.example.cdnmonitor.service;

import com.example.cdnmonitor.model.dto.NewAlert;
import com.example.cdnmonitor.model.dto.ServerSnapshot;

/**
 * Gancho de notificacion. Se invoca tras confirmar el lote del ciclo.
 */
public interface AlertNotifier {

    /**
     * El servidor acaba de pasar a {@code down}.
     */
    void serverDown(ServerSnapshot server);

    /**
     * Se ha creado una alerta de severidad {@code error} o {@code critical}.
     */
    void alertRaised(ServerSnapshot server, NewAlert alert);
}
