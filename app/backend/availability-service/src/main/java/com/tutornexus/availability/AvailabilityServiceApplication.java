package com.tutornexus.availability;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Availability Service Application
 * Weekly availability templates, dated slot inventory and booking conflict checks
 */
@SpringBootApplication
public class AvailabilityServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AvailabilityServiceApplication.class, args);
    }
}
