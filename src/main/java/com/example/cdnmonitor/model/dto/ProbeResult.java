package com.example.cdnmonitor.model.dto;

import com.example.cdnmonitor.model.entity.Server;

public record ProbeResult(
        boolean reachable,
        double latencyMs,
        Integer httpStatus,
        String errorDetail,
        Server.Status status,
        ProbeFailure failure
) {

    public static ProbeResult up(double latencyMs) {
        return new ProbeResult(true, latencyMs, 200, null, Server.Status.UP, ProbeFailure.NONE);
    }

    public static ProbeResult badStatus(double latencyMs, int httpStatus) {
        return new ProbeResult(false, latencyMs, httpStatus, "HTTP " + httpStatus, Server.Status.DOWN, ProbeFailure.PROTOCOL);
    }

    public static ProbeResult transportError(double latencyMs, String detail) {
        return new ProbeResult(false, latencyMs, null, detail, Server.Status.DOWN, ProbeFailure.TRANSPORT);
    }

    public static ProbeResult unexpectedError(double latencyMs, String detail) {
        return new ProbeResult(false, latencyMs, null, detail, Server.Status.UNKNOWN, ProbeFailure.UNEXPECTED);
    }
}
