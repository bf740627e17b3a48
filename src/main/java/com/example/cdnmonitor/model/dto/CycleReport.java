package com.example.cdnmonitor.model.dto;

import java.time.Instant;

public record CycleReport(
        String cycleId,
        Instant startedAt,
        Instant finishedAt,
        int serversPolled,
        int serversReachable,
        int samplesWritten,
        int alertsCreated,
        boolean committed
) {
}
