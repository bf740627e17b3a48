package com.example.cdnmonitor.controller;

import com.example.cdnmonitor.model.dto.ProbeResult;
import com.example.cdnmonitor.model.dto.ServerDto;
import com.example.cdnmonitor.model.entity.Server;
import com.example.cdnmonitor.service.DuplicateServerException;
import com.example.cdnmonitor.service.ServerRegistryService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ServerApiController.class)
@AutoConfigureMockMvc(addFilters = false)
class ServerApiControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ServerRegistryService registry;

    private static ServerDto dto(Long id, String hostname) {
        Instant now = Instant.parse("2024-05-01T12:00:00Z");
        return new ServerDto(id, hostname, "10.0.0.1", 1985, Server.Role.ORIGIN, Server.Status.UP,
                "http://" + hostname + ":1985", Server.ApiType.SRS, now, now, null);
    }

    @Test
    void listUsesLowercaseCodes() throws Exception {
        when(registry.list()).thenReturn(List.of(dto(1L, "origin-1")));

        mockMvc.perform(get("/api/servers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].hostname").value("origin-1"))
                .andExpect(jsonPath("$[0].role").value("origin"))
                .andExpect(jsonPath("$[0].status").value("up"))
                .andExpect(jsonPath("$[0].apiType").value("srs"))
                .andExpect(jsonPath("$[0].apiToken").doesNotExist());
    }

    @Test
    void registerReturnsCreated() throws Exception {
        when(registry.register(any())).thenReturn(dto(3L, "lb-1"));

        mockMvc.perform(post("/api/servers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"hostname":"lb-1","ipAddress":"10.0.0.3","role":"load-balancer","apiType":"generic"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(3));
    }

    @Test
    void registerValidatesBody() throws Exception {
        mockMvc.perform(post("/api/servers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"hostname":"","ipAddress":"10.0.0.3","role":"edge","port":70000}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details").isArray());

        verify(registry, never()).register(any());
    }

    @Test
    void registerRejectsUnknownRole() throws Exception {
        mockMvc.perform(post("/api/servers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"hostname":"x","ipAddress":"10.0.0.3","role":"cache"}
                                """))
                .andExpect(status().isBadRequest());
    }

    @Test
    void duplicateHostnameIsConflict() throws Exception {
        when(registry.register(any())).thenThrow(new DuplicateServerException("edge-1"));

        mockMvc.perform(post("/api/servers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"hostname":"edge-1","ipAddress":"10.0.0.3","role":"edge"}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value(409));
    }

    @Test
    void updateReturnsTheEditedServer() throws Exception {
        when(registry.update(eq(4L), any())).thenReturn(dto(4L, "origin-4b"));

        mockMvc.perform(put("/api/servers/4")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"hostname":"origin-4b","ipAddress":"10.0.0.4","port":1985,"role":"origin","apiType":"srs"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(4))
                .andExpect(jsonPath("$.hostname").value("origin-4b"));

        verify(registry).update(eq(4L), argThat(req -> req != null && "origin-4b".equals(req.hostname())));
    }

    @Test
    void updateToAnotherServersHostnameIsConflict() throws Exception {
        when(registry.update(eq(4L), any())).thenThrow(new DuplicateServerException("edge-1"));

        mockMvc.perform(put("/api/servers/4")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"hostname":"edge-1","ipAddress":"10.0.0.4","role":"edge"}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value(409));
    }

    @Test
    void updateValidatesBodyAndMissingIsNotFound() throws Exception {
        mockMvc.perform(put("/api/servers/4")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"hostname":"edge-1","ipAddress":"","role":"edge"}
                                """))
                .andExpect(status().isBadRequest());
        verify(registry, never()).update(any(), any());

        when(registry.update(eq(9L), any())).thenThrow(new NoSuchElementException("Servidor no encontrado: 9"));
        mockMvc.perform(put("/api/servers/9")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"hostname":"edge-9","ipAddress":"10.0.0.9","role":"edge"}
                                """))
                .andExpect(status().isNotFound());
    }

    @Test
    void deleteReturnsNoContentAndMissingIsNotFound() throws Exception {
        mockMvc.perform(delete("/api/servers/4"))
                .andExpect(status().isNoContent());
        verify(registry).delete(4L);

        doThrow(new NoSuchElementException("Servidor no encontrado: 5")).when(registry).delete(5L);
        mockMvc.perform(delete("/api/servers/5"))
                .andExpect(status().isNotFound());
    }

    @Test
    void testEndpointReturnsProbeResult() throws Exception {
        when(registry.testConnectivity(2L)).thenReturn(ProbeResult.badStatus(12.5, 503));

        mockMvc.perform(post("/api/servers/2/test"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reachable").value(false))
                .andExpect(jsonPath("$.httpStatus").value(503))
                .andExpect(jsonPath("$.status").value("down"));
    }

    @Test
    void metricsParsesIsoWindow() throws Exception {
        when(registry.metrics(eq(1L), eq(Instant.parse("2024-05-01T00:00:00Z")), isNull(), eq(10)))
                .thenReturn(List.of());

        mockMvc.perform(get("/api/servers/1/metrics")
                        .param("since", "2024-05-01T00:00:00Z")
                        .param("limit", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());
    }

    @Test
    void metricsRejectsBadTimestamp() throws Exception {
        mockMvc.perform(get("/api/servers/1/metrics").param("since", "yesterday"))
                .andExpect(status().isBadRequest());
    }
}
