package io.scalex.bridge.gateway;

import io.scalex.bridge.access.OwnershipGuard;
import io.scalex.bridge.canonical.BridgeMessage;
import io.scalex.bridge.canonical.CrossChainConfig;
import io.scalex.bridge.canonical.enums.MessageKind;
import io.scalex.bridge.codec.Addresses;
import io.scalex.bridge.codec.BridgeMessageCodec;
import io.scalex.bridge.codec.MessageIds;
import io.scalex.bridge.error.BridgeErrorCode;
import io.scalex.bridge.error.BridgeException;
import io.scalex.bridge.mailbox.MessageRecipient;
import io.scalex.bridge.mailbox.MessageTransport;
import io.scalex.bridge.store.ProcessedMessageStore;
import io.scalex.bridge.token.FungibleToken;
import io.scalex.bridge.token.TokenDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Source Gateway Service.
 * 
 * Locks whitelisted collateral in custody on a side network and tells the hub
 * ledger about it; releases collateral when the hub sends a RELEASE.
 * 
 * Flow:
 * 1. deposit: validate, pull tokens into custody, dispatch DEPOSIT to the hub
 * 2. handle: authenticate transport and hub, dedup, transfer from custody to the recipient
 * 
 * Custody is the balance this gateway's address holds on each collateral token.
 * All state transitions run under one writer lock.
 * 
 * DEPOSIT sequences come from one gateway-wide counter, so no two deposits from
 * this gateway share a body or a message id. A failed dispatch leaves a gap in
 * the sequence rather than reusing it. Per-depositor nonces are a read-only count.
 */
public class SourceGatewayService implements MessageRecipient {

    private static final Logger log = LoggerFactory.getLogger(SourceGatewayService.class);

    private final String address;
    private final OwnershipGuard ownership;
    private final TokenDirectory tokens;
    private final ProcessedMessageStore processedMessages;

    private final ReentrantLock lock = new ReentrantLock();

    private final Set<String> whitelist = Collections.synchronizedSet(new LinkedHashSet<>());
    private final Map<String, String> tokenMappings = new HashMap<>();
    private final Map<String, String> reverseTokenMappings = new HashMap<>();
    private final Map<String, BigInteger> depositNonces = new HashMap<>();
    private BigInteger depositSequence = BigInteger.ZERO;
    private final Map<String, Map<String, BigInteger>> lockedByUser = new HashMap<>();

    private volatile MessageTransport transport;
    private volatile CrossChainConfig crossChainConfig;

    public SourceGatewayService(String address, String owner, TokenDirectory tokens,
                                ProcessedMessageStore processedMessages) {
        if (Addresses.isZero(address)) {
            throw BridgeException.zeroAddress("gateway address");
        }
        this.address = Addresses.normalize(address);
        this.ownership = new OwnershipGuard("SourceGateway", owner);
        this.tokens = tokens;
        this.processedMessages = processedMessages;
    }

    @Override
    public String getAddress() {
        return address;
    }

    /**
     * Lock {@code amount} of {@code token} from {@code caller} and dispatch a DEPOSIT
     * crediting {@code recipient} on the hub.
     *
     * <p>The caller must have approved this gateway for at least {@code amount}.
     *
     * @return message id of the dispatched DEPOSIT
     */
    public String deposit(String caller, String token, BigInteger amount, String recipient) {
        lock.lock();
        try {
            if (!isTokenWhitelisted(token)) {
                log.warn("Deposit rejected, token not whitelisted: caller={}, token={}", caller, token);
                throw new BridgeException(BridgeErrorCode.NOT_WHITELISTED, "Token is not whitelisted: " + token);
            }
            if (amount == null || amount.signum() <= 0) {
                throw BridgeException.invalidAmount(amount);
            }
            if (Addresses.isZero(caller)) {
                throw BridgeException.zeroAddress("depositor");
            }
            if (Addresses.isZero(recipient)) {
                throw BridgeException.zeroAddress("recipient");
            }
            CrossChainConfig config = requireConfigured();
            FungibleToken collateral = requireToken(token);
            String user = Addresses.normalize(caller);

            // Pull into custody; fails INSUFFICIENT_FUNDS with nothing moved
            BigInteger allowanceBefore = collateral.allowance(user, address);
            collateral.transferFrom(address, user, address, amount);

            BigInteger sequence = depositSequence;
            BigInteger userNonce = depositNonces.getOrDefault(user, BigInteger.ZERO);
            depositSequence = sequence.add(BigInteger.ONE);
            depositNonces.put(user, userNonce.add(BigInteger.ONE));

            BridgeMessage deposit = BridgeMessage.builder()
                .kind(MessageKind.DEPOSIT)
                .token(collateral.getAddress())
                .recipient(Addresses.normalize(recipient))
                .amount(amount)
                .originDomain(config.getLocalDomain())
                .sequence(sequence)
                .build();

            String messageId;
            try {
                messageId = transport.dispatch(address, config.getDestinationDomain(),
                    config.getDestinationGateway(), BridgeMessageCodec.encode(deposit));
            } catch (RuntimeException e) {
                collateral.transfer(address, user, amount);
                collateral.approve(user, address, allowanceBefore);
                depositNonces.put(user, userNonce);
                log.error("Deposit dispatch failed, custody pull reverted: user={}, amount={} {}",
                    user, amount, collateral.getSymbol(), e);
                if (e instanceof BridgeException) {
                    throw e;
                }
                throw new BridgeException(BridgeErrorCode.DISPATCH_FAILED, "Failed to dispatch deposit", e);
            }
            adjustLocked(user, collateral.getAddress(), amount);

            log.info("Deposit dispatched: id={}, user={}, recipient={}, amount={} {}, sequence={}, hub={}:{}",
                messageId, user, deposit.getRecipient(), amount, collateral.getSymbol(), sequence,
                config.getDestinationDomain(), config.getDestinationGateway());
            return messageId;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void handle(String caller, int originDomain, String sender, byte[] body) {
        lock.lock();
        try {
            CrossChainConfig config = requireConfigured();
            if (caller == null || !Addresses.same(caller, config.getTransportAddress())) {
                throw BridgeException.unauthorized(caller, "deliver messages to the source gateway");
            }
            if (originDomain != config.getDestinationDomain()
                || !Addresses.same(sender, config.getDestinationGateway())) {
                log.warn("Rejected message from untrusted origin: domain={}, sender={}", originDomain, sender);
                throw BridgeException.untrustedOrigin(originDomain, sender);
            }

            BridgeMessage message = BridgeMessageCodec.decode(body);
            if (message.getKind() != MessageKind.RELEASE) {
                throw new BridgeException(BridgeErrorCode.INVALID_MESSAGE_KIND,
                    "Source gateway only accepts RELEASE messages, got " + message.getKind().getValue());
            }

            String messageId = MessageIds.compute(originDomain, sender, body);
            if (processedMessages.isProcessed(messageId)) {
                log.warn("Message already processed, ignoring redelivery: id={}", messageId);
                return;
            }
            applyRelease(messageId, message);
        } finally {
            lock.unlock();
        }
    }

    private void applyRelease(String messageId, BridgeMessage message) {
        if (message.getAmount().signum() <= 0) {
            throw BridgeException.invalidAmount(message.getAmount());
        }
        if (Addresses.isZero(message.getRecipient())) {
            throw BridgeException.zeroAddress("release recipient");
        }
        String localToken = reverseTokenMappings.get(message.getToken());
        if (localToken == null) {
            log.error("UNMAPPED TOKEN: release {} of {} {} to {} has no local token",
                messageId, message.getAmount(), message.getToken(), message.getRecipient());
            throw new BridgeException(BridgeErrorCode.UNMAPPED_TOKEN,
                "No local token mapped to synthetic " + message.getToken());
        }
        FungibleToken collateral = requireToken(localToken);

        collateral.transfer(address, message.getRecipient(), message.getAmount());
        if (!processedMessages.markProcessed(messageId)) {
            collateral.transfer(message.getRecipient(), address, message.getAmount());
            log.warn("Concurrent application of message {} detected, release undone", messageId);
            return;
        }
        adjustLocked(message.getRecipient(), collateral.getAddress(), message.getAmount().negate());

        log.info("Release applied: id={}, recipient={}, amount={} {}, sequence={}",
            messageId, message.getRecipient(), message.getAmount(), collateral.getSymbol(), message.getSequence());
    }

    public void addWhitelistedToken(String caller, String token) {
        ownership.checkOwner(caller, "addWhitelistedToken");
        if (Addresses.isZero(token)) {
            throw BridgeException.zeroAddress("token");
        }
        requireToken(token);
        if (!whitelist.add(Addresses.normalize(token))) {
            throw new BridgeException(BridgeErrorCode.TOKEN_ALREADY_WHITELISTED, "Token already whitelisted: " + token);
        }
        log.info("Token whitelisted: {}", Addresses.normalize(token));
    }

    public void removeWhitelistedToken(String caller, String token) {
        ownership.checkOwner(caller, "removeWhitelistedToken");
        if (!whitelist.remove(Addresses.normalize(token))) {
            throw new BridgeException(BridgeErrorCode.NOT_WHITELISTED, "Token is not whitelisted: " + token);
        }
        log.info("Token removed from whitelist: {}", Addresses.normalize(token));
    }

    /**
     * Record the synthetic counterpart of a local token. Releases resolve their
     * local token through the reverse of this mapping.
     *
     * <p>Reverse entries are never dropped: after a remap, hub balances of the
     * previous synthetic can still be withdrawn against the same collateral.
     */
    public void setTokenMapping(String caller, String sourceToken, String syntheticToken) {
        ownership.checkOwner(caller, "setTokenMapping");
        if (Addresses.isZero(sourceToken)) {
            throw BridgeException.zeroAddress("source token");
        }
        if (Addresses.isZero(syntheticToken)) {
            throw BridgeException.zeroAddress("synthetic token");
        }
        String local = Addresses.normalize(sourceToken);
        String synthetic = Addresses.normalize(syntheticToken);
        lock.lock();
        try {
            String previous = tokenMappings.put(local, synthetic);
            if (previous != null && !previous.equals(synthetic)) {
                log.warn("Token mapping for {} changed from {} to {}; releases of {} still resolve to {}",
                    local, previous, synthetic, previous, local);
            }
            reverseTokenMappings.put(synthetic, local);
        } finally {
            lock.unlock();
        }
        log.info("Token mapping set: {} -> {}", local, synthetic);
    }

    /**
     * Set the transport, local domain and hub counterpart. May be called any number of times.
     */
    public CrossChainConfig updateCrossChainConfig(String caller, MessageTransport transport, int localDomain,
                                                   int destinationDomain, String destinationGateway) {
        ownership.checkOwner(caller, "updateCrossChainConfig");
        if (transport == null) {
            throw BridgeException.zeroAddress("transport");
        }
        if (Addresses.isZero(destinationGateway)) {
            throw BridgeException.zeroAddress("destination gateway");
        }
        CrossChainConfig config = CrossChainConfig.builder()
            .transportAddress(Addresses.normalize(transport.getAddress()))
            .localDomain(localDomain)
            .destinationDomain(destinationDomain)
            .destinationGateway(Addresses.normalize(destinationGateway))
            .build();
        lock.lock();
        try {
            this.transport = transport;
            this.crossChainConfig = config;
        } finally {
            lock.unlock();
        }
        log.info("Cross-chain config updated: transport={}, localDomain={}, hub={}:{}",
            config.getTransportAddress(), localDomain, destinationDomain, config.getDestinationGateway());
        return config;
    }

    public void transferOwnership(String caller, String newOwner) {
        ownership.transferOwnership(caller, newOwner);
    }

    public boolean isTokenWhitelisted(String token) {
        if (Addresses.isZero(token)) {
            return false;
        }
        return whitelist.contains(Addresses.normalize(token));
    }

    public List<String> getWhitelistedTokens() {
        synchronized (whitelist) {
            return new ArrayList<>(whitelist);
        }
    }

    public String getTokenMapping(String sourceToken) {
        lock.lock();
        try {
            return tokenMappings.getOrDefault(Addresses.normalize(sourceToken), Addresses.ZERO);
        } finally {
            lock.unlock();
        }
    }

    public String getReverseTokenMapping(String syntheticToken) {
        lock.lock();
        try {
            return reverseTokenMappings.getOrDefault(Addresses.normalize(syntheticToken), Addresses.ZERO);
        } finally {
            lock.unlock();
        }
    }

    public Optional<CrossChainConfig> getCrossChainConfig() {
        return Optional.ofNullable(crossChainConfig);
    }

    public MessageTransport getTransport() {
        return transport;
    }

    public boolean isMessageProcessed(String messageId) {
        return processedMessages.isProcessed(messageId);
    }

    /**
     * Sequence the next DEPOSIT will carry.
     */
    public BigInteger getDepositSequence() {
        lock.lock();
        try {
            return depositSequence;
        } finally {
            lock.unlock();
        }
    }

    public BigInteger getUserNonce(String user) {
        lock.lock();
        try {
            return depositNonces.getOrDefault(Addresses.normalize(user), BigInteger.ZERO);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Custody balance of {@code token}.
     */
    public BigInteger getLockedBalance(String token) {
        return requireToken(token).balanceOf(address);
    }

    /**
     * Collateral locked by {@code user}, net of releases paid to {@code user}.
     * Diagnostic only: a release may go to a different recipient than the depositor.
     */
    public BigInteger getLockedBalance(String user, String token) {
        lock.lock();
        try {
            return lockedByUser
                .getOrDefault(Addresses.normalize(user), Collections.emptyMap())
                .getOrDefault(Addresses.normalize(token), BigInteger.ZERO);
        } finally {
            lock.unlock();
        }
    }

    public String getOwner() {
        return ownership.getOwner();
    }

    private void adjustLocked(String user, String token, BigInteger delta) {
        Map<String, BigInteger> balances = lockedByUser.computeIfAbsent(user, u -> new HashMap<>());
        BigInteger updated = balances.getOrDefault(token, BigInteger.ZERO).add(delta);
        balances.put(token, updated.signum() < 0 ? BigInteger.ZERO : updated);
    }

    private FungibleToken requireToken(String token) {
        return tokens.find(token)
            .orElseThrow(() -> new BridgeException(BridgeErrorCode.NOT_WHITELISTED,
                "Unknown token on this network: " + token));
    }

    private CrossChainConfig requireConfigured() {
        CrossChainConfig config = crossChainConfig;
        if (config == null || transport == null) {
            throw new BridgeException(BridgeErrorCode.NOT_CONFIGURED, "Source gateway cross-chain config is not set");
        }
        return config;
    }
}
