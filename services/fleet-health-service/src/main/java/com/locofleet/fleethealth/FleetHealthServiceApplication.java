package com.locofleet.fleethealth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Fleet Health Service
 *
 * Discovers emulator instances through the cluster orchestrator, probes their health on
 * independent cadences, classifies failures and drives bounded auto-recovery.
 */
@SpringBootApplication(scanBasePackages = {
    "com.locofleet.fleethealth",
    "com.locofleet.common"
})
@EnableScheduling
public class FleetHealthServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(FleetHealthServiceApplication.class, args);
    }
}
