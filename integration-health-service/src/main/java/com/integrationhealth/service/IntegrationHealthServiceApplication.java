package com.integrationhealth.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IntegrationHealthServiceApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(IntegrationHealthServiceApplication.class, args);
    }
}
