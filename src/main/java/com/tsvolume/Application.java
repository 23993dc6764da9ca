package com.tsvolume;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main Spring Boot application for the volume-based time-series store.
 *
 * Points are ingested into an in-memory write cache and flushed into a fixed set
 * of finite-capacity volumes. When the active volume overflows the store rotates
 * to the next volume, evicting its old contents, so writes are never refused for
 * lack of space.
 *
 * Features:
 * - Write cache that makes every accepted point immediately queryable
 * - Rotating volumes with bounded retention
 * - Forward and backward range queries streamed as CSV or JSON
 * - Per-volume free space stats for external polling
 * - RESP-style line protocol decoding for raw ingestion payloads
 */
@SpringBootApplication
@EnableConfigurationProperties
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
