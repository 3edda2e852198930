package io.scalex.bridge.access;

import io.scalex.bridge.codec.Addresses;
import io.scalex.bridge.error.BridgeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-owner gate for admin operations.
 */
public class OwnershipGuard {

    private static final Logger log = LoggerFactory.getLogger(OwnershipGuard.class);

    private final String component;
    private volatile String owner;

    public OwnershipGuard(String component, String owner) {
        if (Addresses.isZero(owner)) {
            throw BridgeException.zeroAddress(component + " owner");
        }
        this.component = component;
        this.owner = Addresses.normalize(owner);
    }

    public String getOwner() {
        return owner;
    }

    /**
     * @throws BridgeException UNAUTHORIZED unless {@code caller} is the owner
     */
    public void checkOwner(String caller, String action) {
        if (caller == null || caller.isBlank() || !Addresses.same(caller, owner)) {
            log.warn("Rejected {} on {}: caller {} is not the owner", action, component, caller);
            throw BridgeException.unauthorized(caller, action + " on " + component);
        }
    }

    public synchronized void transferOwnership(String caller, String newOwner) {
        checkOwner(caller, "transferOwnership");
        if (Addresses.isZero(newOwner)) {
            throw BridgeException.zeroAddress("new owner");
        }
        String previous = owner;
        owner = Addresses.normalize(newOwner);
        log.info("Ownership of {} transferred from {} to {}", component, previous, owner);
    }
}
