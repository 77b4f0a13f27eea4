package com.vibecoding.pvecheck.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;


@Configuration
@ConfigurationProperties(prefix = "proxmox")
@Data
public class ProxmoxClientProperties {

    private static final Logger log = LoggerFactory.getLogger(ProxmoxClientProperties.class);

    private String apiBasePath = "/api2/json";
    private Integer connectTimeout = 10000;
    private Integer readTimeout = 30000;
    // Proxmox 티켓 유효 시간 (2시간)
    private Long ticketLifetimeSeconds = 7200L;

    @PostConstruct
    public void init() {
        validateConfig();
    }

    public void validateConfig() {
        if (connectTimeout == null || connectTimeout <= 0 || readTimeout == null || readTimeout <= 0) {
            throw new IllegalStateException("proxmox.connect-timeout and proxmox.read-timeout must be positive");
        }
        if (ticketLifetimeSeconds == null || ticketLifetimeSeconds <= 0) {
            throw new IllegalStateException("proxmox.ticket-lifetime-seconds must be positive");
        }

        log.debug("Proxmox client configuration");
        log.debug("  - API base path: {}", apiBasePath);
        log.debug("  - Timeouts: connect {}ms, read {}ms", connectTimeout, readTimeout);
        log.debug("  - Ticket lifetime: {}s", ticketLifetimeSeconds);
    }
}
