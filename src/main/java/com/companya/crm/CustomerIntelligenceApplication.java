package com.companya.crm;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling // Necessary to enable the @Scheduled daily update job
public class CustomerIntelligenceApplication {
    public static void main(String[] args) {
        SpringApplication.run(CustomerIntelligenceApplication.class, args);
    }
}
