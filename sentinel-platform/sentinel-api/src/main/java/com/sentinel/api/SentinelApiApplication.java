package com.sentinel.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Sentinel moderation API.
 *
 * Content classification, enforcement, strikes, review queue, reports and appeals.
 */
@SpringBootApplication(scanBasePackages = "com.sentinel")
@EntityScan(basePackages = "com.sentinel.core.domain")
@EnableJpaRepositories(basePackages = "com.sentinel.core.repository")
public class SentinelApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(SentinelApiApplication.class, args);
    }
}
