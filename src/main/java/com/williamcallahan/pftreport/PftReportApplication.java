package com.williamcallahan.pftreport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot entry point for the PFT report pipeline service.
 */
@SpringBootApplication
public class PftReportApplication {

    public static void main(String[] args) {
        SpringApplication.run(PftReportApplication.class, args);
    }
}
