package io.scalex.bridge.hub.ledger;

import io.scalex.bridge.canonical.ChainEndpoint;
import io.scalex.bridge.canonical.CrossChainConfig;
import io.scalex.bridge.hub.registry.TokenRegistry;
import io.scalex.bridge.mailbox.MessageRecipient;
import io.scalex.bridge.mailbox.MessageTransport;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Hub-side bridge ledger.
 * 
 * Consumers (transport wiring, REST API, tests) depend on this interface, not on
 * a concrete implementation, so an implementation can be replaced by wiring a
 * different one. Replacing an implementation that keeps state in a different
 * layout requires an explicit state migration; none is assumed.
 */
public interface HubLedger extends MessageRecipient {

    // Inbound and outbound messages

    String requestWithdraw(String user, String syntheticToken, BigInteger amount, int targetDomain);

    String requestWithdraw(String user, String syntheticToken, BigInteger amount, int targetDomain, String recipient);

    // Admin

    ChainEndpoint setChainEndpoint(String caller, int domain, String gatewayAddress);

    void setTokenRegistry(String caller, TokenRegistry tokenRegistry);

    CrossChainConfig updateCrossChainConfig(String caller, MessageTransport transport, int localDomain);

    void transferOwnership(String caller, String newOwner);

    // Read

    BigInteger getBalance(String user, String asset);

    boolean isMessageProcessed(String messageId);

    Optional<ChainEndpoint> getChainEndpoint(int domain);

    Optional<CrossChainConfig> getCrossChainConfig();

    long getUserProcessedCount(String user);

    BigInteger getUserNonce(String user);

    BigInteger getTotalCredited(String asset);

    String getOwner();
}
