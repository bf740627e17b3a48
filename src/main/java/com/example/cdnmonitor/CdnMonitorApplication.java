package com.example.cdnmonitor;

import com.example.cdnmonitor.config.MonitoringProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({MonitoringProperties.class})
public class CdnMonitorApplication {
    public static void main(String[] args) {
        SpringApplication.run(CdnMonitorApplication.class, args);
    }
}
