package com.example.cdnmonitor.service.collector;

import com.example.cdnmonitor.TestServers;
import com.example.cdnmonitor.model.dto.MetricReading;
import com.example.cdnmonitor.model.dto.ServerSnapshot;
import com.example.cdnmonitor.model.entity.Server;
import com.example.cdnmonitor.service.UpstreamHttpClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GenericMetricCollectorTest {

    private static final String URL = "http://lb-1:8080/health";

    private MockRestServiceServer upstream;
    private GenericMetricCollector collector;
    private final ServerSnapshot server = TestServers.generic(3, "lb-1");

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        upstream = MockRestServiceServer.bindTo(builder).build();
        RestClient client = builder.build();
        collector = new GenericMetricCollector(new UpstreamHttpClient(client, client), new ObjectMapper());
    }

    @Test
    void readsKnownKeysWhenPresent() {
        upstream.expect(requestTo(URL))
                .andRespond(withSuccess("{\"connections\":12,\"cpu\":91.5,\"memory\":\"40\"}", MediaType.APPLICATION_JSON));

        MetricReading reading = collector.collect(server);

        assertEquals(12, reading.activeConnections());
        assertEquals(91.5, reading.cpuUsage(), 1e-9);
        assertEquals(40.0, reading.memoryUsage(), 1e-9);
        assertNotNull(reading.responseTime());
    }

    @Test
    void missingKeysAreNotAnError() {
        upstream.expect(requestTo(URL))
                .andRespond(withSuccess("{\"status\":\"ok\"}", MediaType.APPLICATION_JSON));

        MetricReading reading = collector.collect(server);

        assertNull(reading.activeConnections());
        assertNull(reading.cpuUsage());
        assertEquals(0, reading.errorCount());
    }

    @Test
    void plainTextBodyOnlyReportsResponseTime() {
        upstream.expect(requestTo(URL))
                .andRespond(withSuccess("healthy", MediaType.TEXT_PLAIN));

        MetricReading reading = collector.collect(server);

        assertEquals(0, reading.errorCount());
        assertNotNull(reading.responseTime());
        assertNull(reading.memoryUsage());
    }

    @Test
    void serverWithoutEndpointReturnsDefaults() {
        ServerSnapshot bare = new ServerSnapshot(9L, "bare", "10.9.9.9", 80, Server.Role.EDGE, Server.Status.UP,
                null, Server.ApiType.GENERIC, null, null, null);

        MetricReading reading = collector.collect(bare);

        assertEquals(MetricReading.empty(), reading);
        upstream.verify();
    }
}
