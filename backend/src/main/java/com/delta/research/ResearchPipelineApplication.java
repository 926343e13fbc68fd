package com.delta.research;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ResearchPipelineApplication {
    public static void main(String[] args) {
        SpringApplication.run(ResearchPipelineApplication.class, args);
    }
}
