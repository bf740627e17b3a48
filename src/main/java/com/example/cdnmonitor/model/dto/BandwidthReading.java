package com.example.cdnmonitor.model.dto;

/**
 * Resultado best-effort del enriquecimiento de ancho de banda.
 * {@link Source#NONE} significa "sin datos", distinto de una lectura valida a cero.
 */
public record BandwidthReading(
        Source source,
        Double bandwidthInMbps,
        Double bandwidthOutMbps,
        Long bytesReceived,
        Long bytesSent,
        Integer streamCount
) {

    public enum Source { STREAMS, SUMMARIES, NONE }

    public static BandwidthReading unavailable() {
        return new BandwidthReading(Source.NONE, null, null, null, null, null);
    }

    public boolean isAvailable() {
        return source != Source.NONE;
    }
}
