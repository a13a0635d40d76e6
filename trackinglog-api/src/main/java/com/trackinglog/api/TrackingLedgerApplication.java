package com.trackinglog.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * Main application entry point for the Delivery Tracking Ledger.
 */
@SpringBootApplication
@ComponentScan(basePackages = {
    "com.trackinglog.api",
    "com.trackinglog.engine"
})
public class TrackingLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrackingLedgerApplication.class, args);
    }
}
