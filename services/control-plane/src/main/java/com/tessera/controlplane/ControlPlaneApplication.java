package com.tessera.controlplane;

import com.tessera.controlplane.config.ControlPlaneProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Tessera control plane.
 *
 * <p>Every {@code /api/**} request passes the access guard before reaching a controller: the
 * credential is validated, the tenant resolved, the rate limit applied and the resulting tenant
 * scope bound for the duration of the request. Actuator endpoints are not guarded.
 */
@SpringBootApplication
@EnableConfigurationProperties(ControlPlaneProperties.class)
public class ControlPlaneApplication {

    private static final Logger log = LoggerFactory.getLogger(ControlPlaneApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(ControlPlaneApplication.class, args);
        log.info("Tessera control plane started");
    }
}
