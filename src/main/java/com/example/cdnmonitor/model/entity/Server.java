package com.example.cdnmonitor.model.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.Locale;

@Entity
@Table(name = "server")
public class Server {

    public enum Role {
        ORIGIN("origin"), EDGE("edge"), LOAD_BALANCER("load-balancer");

        private final String code;

        Role(String code) { this.code = code; }

        @JsonValue
        public String code() { return code; }

        @JsonCreator
        public static Role fromCode(String raw) {
            return Codes.resolve(Role.values(), raw, Role::code);
        }
    }

    public enum Status {
        UP, DOWN, UNKNOWN;

        @JsonValue
        public String code() { return name().toLowerCase(Locale.ROOT); }
    }

    /**
     * Dialecto de la API de estado que expone el servidor.
     */
    public enum ApiType {
        SRS, NGINX, GENERIC;

        @JsonValue
        public String code() { return name().toLowerCase(Locale.ROOT); }

        @JsonCreator
        public static ApiType fromCode(String raw) {
            return Codes.resolve(ApiType.values(), raw, ApiType::code);
        }
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 255)
    private String hostname;

    @Column(name = "ip_address", nullable = false, length = 45)
    private String ipAddress;

    @Column(nullable = false)
    private int port = 80;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Role role;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Status status = Status.UNKNOWN;

    @Column(name = "api_endpoint", length = 255)
    private String apiEndpoint;

    @Enumerated(EnumType.STRING)
    @Column(name = "api_type", nullable = false, length = 20)
    private ApiType apiType = ApiType.SRS;

    @Column(name = "api_token", length = 512)
    private String apiToken;

    @Column(name = "api_username", length = 255)
    private String apiUsername;

    @Column(name = "api_password", length = 255)
    private String apiPassword;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void touch() {
        updatedAt = Instant.now();
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getHostname() { return hostname; }
    public void setHostname(String hostname) { this.hostname = hostname; }

    public String getIpAddress() { return ipAddress; }
    public void setIpAddress(String ipAddress) { this.ipAddress = ipAddress; }

    public int getPort() { return port; }
    public void setPort(int port) { this.port = port; }

    public Role getRole() { return role; }
    public void setRole(Role role) { this.role = role; }

    public Status getStatus() { return status; }
    public void setStatus(Status status) { this.status = status; }

    public String getApiEndpoint() { return apiEndpoint; }
    public void setApiEndpoint(String apiEndpoint) { this.apiEndpoint = apiEndpoint; }

    public ApiType getApiType() { return apiType; }
    public void setApiType(ApiType apiType) { this.apiType = apiType; }

    public String getApiToken() { return apiToken; }
    public void setApiToken(String apiToken) { this.apiToken = apiToken; }

    public String getApiUsername() { return apiUsername; }
    public void setApiUsername(String apiUsername) { this.apiUsername = apiUsername; }

    public String getApiPassword() { return apiPassword; }
    public void setApiPassword(String apiPassword) { this.apiPassword = apiPassword; }

    public Instant getCreatedAt() { return createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
}
