package com.platform.relay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Tools Relay Application
 *
 * Shared, tenant-agnostic relay between tenant backends and the executors
 * running inside tenant VMs:
 * - Authenticates tenants by bearer secret and resolves their encryption key
 * - Packages automation scripts as AES-256-GCM encrypted execution units
 * - Relays commands to executors over persistent WebSocket connections
 * - Provisions isolated per-tenant networks and multi-homes the relay onto them
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class RelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(RelayApplication.class, args);
    }
}
