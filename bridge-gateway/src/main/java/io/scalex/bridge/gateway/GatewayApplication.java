package io.scalex.bridge.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Source Gateway Application.
 * 
 * Main entry point for one side network of the bridge.
 * 
 * This service:
 * - Locks whitelisted collateral deposited by users
 * - Dispatches DEPOSIT messages to the hub domain's mailbox
 * - Consumes RELEASE messages and pays collateral out of custody
 */
@SpringBootApplication
public class GatewayApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(GatewayApplication.class, args);
    }
}
