package com.example.cdnmonitor.model.entity;

import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.Locale;

@Entity
@Table(name = "alert", indexes = {
        @Index(name = "idx_alert_open", columnList = "server_id, alert_type, acknowledged")
})
public class Alert {

    public enum Type {
        SERVER_DOWN, CPU_HIGH, MEMORY_HIGH, RESPONSE_SLOW;

        @JsonValue
        public String code() { return name().toLowerCase(Locale.ROOT); }
    }

    public enum Severity {
        INFO, WARNING, ERROR, CRITICAL;

        @JsonValue
        public String code() { return name().toLowerCase(Locale.ROOT); }

        /**
         * Severidades que disparan notificacion inmediata.
         */
        public boolean isUrgent() {
            return this == ERROR || this == CRITICAL;
        }
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "server_id", nullable = false)
    private Server server;

    @Enumerated(EnumType.STRING)
    @Column(name = "alert_type", nullable = false, length = 50)
    private Type alertType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Severity severity = Severity.WARNING;

    @Lob
    @Column(nullable = false)
    private String message;

    @Column(nullable = false)
    private boolean acknowledged = false;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "acknowledged_at")
    private Instant acknowledgedAt;

    /**
     * Marca la alerta como reconocida. La fecha se fija solo la primera vez.
     */
    public void acknowledge(Instant when) {
        if (acknowledged) return;
        acknowledged = true;
        acknowledgedAt = when;
    }

    public Long getId() { return id; }

    public Server getServer() { return server; }
    public void setServer(Server server) { this.server = server; }

    public Type getAlertType() { return alertType; }
    public void setAlertType(Type alertType) { this.alertType = alertType; }

    public Severity getSeverity() { return severity; }
    public void setSeverity(Severity severity) { this.severity = severity; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }

    public boolean isAcknowledged() { return acknowledged; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getAcknowledgedAt() { return acknowledgedAt; }
}
