package com.sportsautobet;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main Spring Boot application for the daily sports picks service.
 */
@SpringBootApplication
@EnableScheduling
public class SportsAutobetApplication {

    public static void main(String[] args) {
        SpringApplication.run(SportsAutobetApplication.class, args);
    }
}
