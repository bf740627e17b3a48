package com.example.cdnmonitor.model.dto;

/**
 * Clasificacion del fallo de una sonda de conectividad.
 */
public enum ProbeFailure {
    /** HTTP 200 dentro del timeout. */
    NONE,
    /** DNS, conexion rechazada o timeout: el servidor se marca caido. */
    TRANSPORT,
    /** Respuesta distinta de 200. */
    PROTOCOL,
    /** Fallo de la propia sonda; el servidor queda en estado desconocido. */
    UNEXPECTED
}
