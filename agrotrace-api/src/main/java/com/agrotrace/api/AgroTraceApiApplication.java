package com.agrotrace.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * AgroTrace Platform API Application
 *
 * Farmer identity registry and sustainable-practice claim log.
 */
@SpringBootApplication(scanBasePackages = "com.agrotrace")
@EntityScan(basePackages = "com.agrotrace.core.domain")
@EnableJpaRepositories(basePackages = "com.agrotrace.core.repository")
public class AgroTraceApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgroTraceApiApplication.class, args);
    }
}
