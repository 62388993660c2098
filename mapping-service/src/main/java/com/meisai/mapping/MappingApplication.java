package com.meisai.mapping;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MappingApplication {
    public static void main(String[] args) { SpringApplication.run(MappingApplication.class, args); }
}
