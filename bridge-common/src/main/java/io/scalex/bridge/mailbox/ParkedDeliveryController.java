package io.scalex.bridge.mailbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST Controller for parked mailbox deliveries.
 */
@RestController
@RequestMapping("/api/mailbox/failures")
public class ParkedDeliveryController {
    
    private static final Logger log = LoggerFactory.getLogger(ParkedDeliveryController.class);
    
    private final ParkedDeliveryStore parkedDeliveryStore;
    
    public ParkedDeliveryController(ParkedDeliveryStore parkedDeliveryStore) {
        this.parkedDeliveryStore = parkedDeliveryStore;
    }
    
    /**
     * List deliveries still waiting for a retry.
     */
    @GetMapping
    public ResponseEntity<List<ParkedDelivery>> getParked() {
        return ResponseEntity.ok(parkedDeliveryStore.getParked());
    }
    
    @GetMapping("/{parkId}")
    public ResponseEntity<ParkedDelivery> getParkedDelivery(@PathVariable String parkId) {
        return parkedDeliveryStore.get(parkId)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }
    
    /**
     * Retry one parked delivery.
     */
    @PostMapping("/{parkId}/retry")
    public ResponseEntity<ParkedDelivery> retry(@PathVariable String parkId) {
        try {
            return parkedDeliveryStore.retry(parkId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
        } catch (Exception e) {
            log.error("Error retrying parked delivery: {}", parkId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
        }
    }
    
    /**
     * Retry every parked delivery.
     */
    @PostMapping("/retry")
    public ResponseEntity<Map<String, Object>> retryAll() {
        int delivered = parkedDeliveryStore.retryAll();
        return ResponseEntity.ok(Map.of(
            "delivered", delivered,
            "stillParked", parkedDeliveryStore.size()
        ));
    }
}
