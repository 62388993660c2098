package com.meisai.ingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling   // snapshot job + stale stream reaper
@ConfigurationPropertiesScan
public class IngestApplication {
    public static void main(String[] args) { SpringApplication.run(IngestApplication.class, args); }
}
