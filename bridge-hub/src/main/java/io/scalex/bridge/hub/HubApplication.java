package io.scalex.bridge.hub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Hub Ledger Service Application.
 * 
 * Main entry point for the hub side of the bridge.
 * 
 * This service:
 * - Consumes deposit messages from the hub domain's mailbox
 * - Authenticates them against the chain registry and deduplicates by message id
 * - Mints synthetic assets into custody and credits the user ledger
 * - Burns and dispatches release messages for withdrawals
 */
@SpringBootApplication
public class HubApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(HubApplication.class, args);
    }
}
