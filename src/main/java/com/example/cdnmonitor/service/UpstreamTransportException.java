package com.example.cdnmonitor.service;

/**
 * Fallo de transporte contra un servidor monitorizado: DNS, conexion o timeout.
 */
public class UpstreamTransportException extends RuntimeException {

    public UpstreamTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
