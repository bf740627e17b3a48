package com.example.cdnmonitor.config;

import com.example.cdnmonitor.service.UpstreamHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

@Configuration
public class RestClientConfig {

    @Bean
    public UpstreamHttpClient upstreamHttpClient(MonitoringProperties props) {
        return new UpstreamHttpClient(
                restClient(props.getProbeTimeoutMs()),
                restClient(props.getEnrichmentTimeoutMs())
        );
    }

    // Timeout total por peticion (conexion + respuesta).
    private RestClient restClient(long timeoutMs) {
        Duration timeout = Duration.ofMillis(Math.max(1, timeoutMs));
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(timeout);
        return RestClient.builder()
                .requestFactory(factory)
                .build();
    }
}
