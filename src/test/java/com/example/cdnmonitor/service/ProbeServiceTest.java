package com.example.cdnmonitor.service;

import com.example.cdnmonitor.TestServers;
import com.example.cdnmonitor.model.dto.ProbeFailure;
import com.example.cdnmonitor.model.dto.ProbeResult;
import com.example.cdnmonitor.model.dto.ServerSnapshot;
import com.example.cdnmonitor.model.entity.Server;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.headerDoesNotExist;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class ProbeServiceTest {

    private MockRestServiceServer upstream;
    private MonitoringStore store;
    private AlertNotifier notifier;
    private ProbeService probeService;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        upstream = MockRestServiceServer.bindTo(builder).build();
        RestClient client = builder.build();
        store = mock(MonitoringStore.class);
        notifier = mock(AlertNotifier.class);
        probeService = new ProbeService(new UpstreamHttpClient(client, client), store, notifier);
    }

    @Test
    void okResponseMarksServerUp() {
        ServerSnapshot server = TestServers.srs(1, "srs-1");
        upstream.expect(requestTo("http://srs-1:1985")).andRespond(withSuccess());

        ProbeResult result = probeService.probe(server);

        assertTrue(result.reachable());
        assertEquals(Server.Status.UP, result.status());
        assertEquals(200, result.httpStatus());
        assertNull(result.errorDetail());
        assertTrue(result.latencyMs() >= 0);
        verify(store).updateServerStatus(1L, Server.Status.UP);
    }

    @Test
    void usesAddressAndPortWithoutEndpoint() {
        ServerSnapshot server = new ServerSnapshot(4L, "edge-4", "192.168.1.4", 8081, Server.Role.EDGE,
                Server.Status.UNKNOWN, null, Server.ApiType.NGINX, null, null, null);
        upstream.expect(requestTo("http://192.168.1.4:8081")).andRespond(withSuccess());

        assertTrue(probeService.probe(server).reachable());
        upstream.verify();
    }

    @Test
    void nonOkMarksServerDownWithStatusDetail() {
        ServerSnapshot server = TestServers.srs(1, "srs-1");
        upstream.expect(requestTo("http://srs-1:1985")).andRespond(withStatus(HttpStatus.BAD_GATEWAY));

        ProbeResult result = probeService.probe(server);

        assertFalse(result.reachable());
        assertEquals(Server.Status.DOWN, result.status());
        assertEquals(ProbeFailure.PROTOCOL, result.failure());
        assertEquals(502, result.httpStatus());
        assertEquals("HTTP 502", result.errorDetail());
        verify(store).updateServerStatus(1L, Server.Status.DOWN);
    }

    @Test
    void transportFailureMarksServerDown() {
        ServerSnapshot server = TestServers.srs(1, "srs-1");
        upstream.expect(requestTo("http://srs-1:1985"))
                .andRespond(withException(new ConnectException("Connection refused")));

        ProbeResult result = probeService.probe(server);

        assertFalse(result.reachable());
        assertEquals(Server.Status.DOWN, result.status());
        assertEquals(ProbeFailure.TRANSPORT, result.failure());
        assertNotNull(result.errorDetail());
        verify(store).updateServerStatus(1L, Server.Status.DOWN);
    }

    @Test
    void probeMalfunctionMarksServerUnknown() {
        ServerSnapshot server = new ServerSnapshot(5L, "broken", "10.0.0.5", 80, Server.Role.EDGE,
                Server.Status.UP, "http://bad host:80/", Server.ApiType.GENERIC, null, null, null);

        ProbeResult result = probeService.probe(server);

        assertFalse(result.reachable());
        assertEquals(Server.Status.UNKNOWN, result.status());
        assertEquals(ProbeFailure.UNEXPECTED, result.failure());
        verify(store).updateServerStatus(5L, Server.Status.UNKNOWN);
    }

    @Test
    void noCredentialsProbesUnauthenticated() {
        upstream.expect(requestTo("http://srs-1:1985"))
                .andExpect(headerDoesNotExist(HttpHeaders.AUTHORIZATION))
                .andRespond(withSuccess());

        probeService.probe(TestServers.srs(1, "srs-1"));
        upstream.verify();
    }

    @Test
    void tokenIsSentAsBearer() {
        ServerSnapshot server = TestServers.withAuth(TestServers.srs(1, "srs-1"), "s3cr3t", null, null);
        upstream.expect(requestTo("http://srs-1:1985"))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer s3cr3t"))
                .andRespond(withSuccess());

        probeService.probe(server);
        upstream.verify();
    }

    @Test
    void usernameAndPasswordUseBasicAuth() {
        ServerSnapshot server = TestServers.withAuth(TestServers.srs(1, "srs-1"), null, "admin", "pw");
        String expected = "Basic " + Base64.getEncoder().encodeToString("admin:pw".getBytes(StandardCharsets.UTF_8));
        upstream.expect(requestTo("http://srs-1:1985"))
                .andExpect(header(HttpHeaders.AUTHORIZATION, expected))
                .andRespond(withSuccess());

        probeService.probe(server);
        upstream.verify();
    }

    @Test
    void tokenTakesPrecedenceOverBasicAuth() {
        ServerSnapshot server = TestServers.withAuth(TestServers.srs(1, "srs-1"), "tok", "admin", "pw");
        upstream.expect(requestTo("http://srs-1:1985"))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer tok"))
                .andRespond(withSuccess());

        probeService.probe(server);
        upstream.verify();
    }

    @Test
    void transitionIntoDownNotifiesOnce() {
        ServerSnapshot server = TestServers.srs(1, "srs-1");
        when(store.updateServerStatus(1L, Server.Status.DOWN)).thenReturn(Server.Status.UP);
        upstream.expect(requestTo("http://srs-1:1985"))
                .andRespond(withException(new ConnectException("Connection refused")));

        probeService.probe(server);

        verify(notifier).serverDown(argThat(s -> s != null && s.id() == 1L && s.status() == Server.Status.DOWN));
    }

    @Test
    void unknownToDownAlsoNotifies() {
        when(store.updateServerStatus(1L, Server.Status.DOWN)).thenReturn(Server.Status.UNKNOWN);
        upstream.expect(requestTo("http://srs-1:1985")).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        probeService.probe(TestServers.srs(1, "srs-1"));

        verify(notifier).serverDown(any());
    }

    @Test
    void serverAlreadyDownIsNotNotifiedAgain() {
        when(store.updateServerStatus(1L, Server.Status.DOWN)).thenReturn(Server.Status.DOWN);
        upstream.expect(requestTo("http://srs-1:1985")).andRespond(withStatus(HttpStatus.BAD_GATEWAY));

        probeService.probe(TestServers.srs(1, "srs-1"));

        verify(notifier, never()).serverDown(any());
    }

    @Test
    void deletedServerIsNotNotified() {
        when(store.updateServerStatus(1L, Server.Status.DOWN)).thenReturn(null);
        upstream.expect(requestTo("http://srs-1:1985")).andRespond(withStatus(HttpStatus.BAD_GATEWAY));

        probeService.probe(TestServers.srs(1, "srs-1"));

        verify(notifier, never()).serverDown(any());
    }

    @Test
    void recoveryDoesNotNotify() {
        when(store.updateServerStatus(1L, Server.Status.UP)).thenReturn(Server.Status.DOWN);
        upstream.expect(requestTo("http://srs-1:1985")).andRespond(withSuccess());

        probeService.probe(TestServers.srs(1, "srs-1"));

        verify(notifier, never()).serverDown(any());
    }

    @Test
    void notifierFailureDoesNotChangeTheResult() {
        when(store.updateServerStatus(1L, Server.Status.DOWN)).thenReturn(Server.Status.UP);
        doThrow(new IllegalStateException("telegram down")).when(notifier).serverDown(any());
        upstream.expect(requestTo("http://srs-1:1985")).andRespond(withStatus(HttpStatus.BAD_GATEWAY));

        ProbeResult result = probeService.probe(TestServers.srs(1, "srs-1"));

        assertEquals(Server.Status.DOWN, result.status());
    }
}
