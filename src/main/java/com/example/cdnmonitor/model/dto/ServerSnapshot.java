package com.example.cdnmonitor.model.dto;

import com.example.cdnmonitor.model.entity.Server;

/**
 * Copia inmutable de un servidor registrado, tal como la ve un ciclo de monitorizacion.
 */
public record ServerSnapshot(
        Long id,
        String hostname,
        String ipAddress,
        int port,
        Server.Role role,
        Server.Status status,
        String apiEndpoint,
        Server.ApiType apiType,
        String apiToken,
        String apiUsername,
        String apiPassword
) {

    public static ServerSnapshot from(Server server) {
        return new ServerSnapshot(
                server.getId(),
                server.getHostname(),
                server.getIpAddress(),
                server.getPort(),
                server.getRole(),
                server.getStatus(),
                server.getApiEndpoint(),
                server.getApiType(),
                server.getApiToken(),
                server.getApiUsername(),
                server.getApiPassword()
        );
    }

    public boolean hasApiEndpoint() {
        return apiEndpoint != null && !apiEndpoint.isBlank();
    }

    /**
     * URL de la comprobacion de conectividad: el endpoint de API si existe, si no address:port.
     */
    public String probeUrl() {
        if (hasApiEndpoint()) {
            return apiEndpoint.trim();
        }
        return "http://" + ipAddress + ":" + port;
    }

    /**
     * Endpoint de API sin barra final, para componer rutas como /api/v1/clients.
     */
    public String apiBase() {
        if (!hasApiEndpoint()) return null;
        String base = apiEndpoint.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base;
    }

    public boolean hasToken() {
        return apiToken != null && !apiToken.isBlank();
    }

    public boolean hasBasicCredentials() {
        return apiUsername != null && !apiUsername.isBlank()
                && apiPassword != null && !apiPassword.isEmpty();
    }

    public ServerSnapshot withStatus(Server.Status newStatus) {
        return new ServerSnapshot(id, hostname, ipAddress, port, role, newStatus,
                apiEndpoint, apiType, apiToken, apiUsername, apiPassword);
    }

    @Override
    public String toString() {
        return "ServerSnapshot[id=" + id + ", hostname=" + hostname + ", apiType=" + apiType + ", status=" + status + "]";
    }
}
