package io.scalex.bridge.hub.ledger;

import io.scalex.bridge.access.OwnershipGuard;
import io.scalex.bridge.canonical.BridgeMessage;
import io.scalex.bridge.canonical.ChainEndpoint;
import io.scalex.bridge.canonical.CrossChainConfig;
import io.scalex.bridge.canonical.TokenMapping;
import io.scalex.bridge.canonical.enums.MessageKind;
import io.scalex.bridge.codec.Addresses;
import io.scalex.bridge.codec.BridgeMessageCodec;
import io.scalex.bridge.codec.MessageIds;
import io.scalex.bridge.error.BridgeErrorCode;
import io.scalex.bridge.error.BridgeException;
import io.scalex.bridge.hub.asset.SyntheticAsset;
import io.scalex.bridge.hub.asset.SyntheticAssetFactory;
import io.scalex.bridge.hub.registry.ChainRegistry;
import io.scalex.bridge.hub.registry.TokenRegistry;
import io.scalex.bridge.mailbox.MessageTransport;
import io.scalex.bridge.store.ProcessedMessageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Hub ledger: applies deposit messages from source gateways and originates
 * release messages for withdrawals.
 * 
 * Deposit handling:
 * 1. Caller must be the configured transport
 * 2. (origin domain, sender) must match an active chain registry entry
 * 3. Replays of an applied message id are successful no-ops
 * 4. The source token must have an active mapping to a synthetic asset
 * 5. Mint to hub custody, credit the recipient, mark the message id processed
 * 
 * All state transitions run under one writer lock, so each check and the
 * mutation it guards are a single atomic step no matter how deliveries from
 * different domains interleave.
 * 
 * A deposit for an unmapped or inactive token fails without any state change and
 * without marking the message processed. The transport keeps it for retry, and
 * it is credited once the registry is fixed and the message is redelivered.
 * 
 * RELEASE sequences come from one hub-wide counter, so no two withdrawals share
 * a body or a message id. A failed dispatch leaves a gap in the sequence. The
 * per-user withdraw nonce is a read-only count.
 */
public class HubLedgerService implements HubLedger {

    private static final Logger log = LoggerFactory.getLogger(HubLedgerService.class);

    private final String address;
    private final OwnershipGuard ownership;
    private final ChainRegistry chainRegistry;
    private final SyntheticAssetFactory assetFactory;
    private final ProcessedMessageStore processedMessages;
    private final UserLedger userLedger;

    private final ReentrantLock lock = new ReentrantLock();

    private BigInteger releaseSequence = BigInteger.ZERO;

    private volatile TokenRegistry tokenRegistry;
    private volatile MessageTransport transport;
    private volatile CrossChainConfig crossChainConfig;

    public HubLedgerService(String address, String owner, ChainRegistry chainRegistry, TokenRegistry tokenRegistry,
                            SyntheticAssetFactory assetFactory, ProcessedMessageStore processedMessages,
                            UserLedger userLedger) {
        if (Addresses.isZero(address)) {
            throw BridgeException.zeroAddress("hub ledger address");
        }
        this.address = Addresses.normalize(address);
        this.ownership = new OwnershipGuard("HubLedger", owner);
        this.chainRegistry = chainRegistry;
        this.tokenRegistry = tokenRegistry;
        this.assetFactory = assetFactory;
        this.processedMessages = processedMessages;
        this.userLedger = userLedger;
        if (!Addresses.same(assetFactory.getMinter(), this.address)) {
            log.warn("Synthetic asset factory mints as {}, not as this ledger ({}); deposits will fail",
                assetFactory.getMinter(), this.address);
        }
    }

    @Override
    public String getAddress() {
        return address;
    }

    @Override
    public void handle(String caller, int originDomain, String sender, byte[] body) {
        lock.lock();
        try {
            CrossChainConfig config = requireConfigured();
            if (caller == null || !Addresses.same(caller, config.getTransportAddress())) {
                throw BridgeException.unauthorized(caller, "deliver messages to the hub ledger");
            }
            if (!chainRegistry.isTrustedSender(originDomain, sender)) {
                log.warn("Rejected message from untrusted origin: domain={}, sender={}", originDomain, sender);
                throw BridgeException.untrustedOrigin(originDomain, sender);
            }

            String messageId = MessageIds.compute(originDomain, sender, body);
            if (processedMessages.isProcessed(messageId)) {
                log.warn("Message already processed, ignoring redelivery: id={}", messageId);
                return;
            }

            BridgeMessage message = BridgeMessageCodec.decode(body);
            if (message.getKind() != MessageKind.DEPOSIT) {
                throw new BridgeException(BridgeErrorCode.INVALID_MESSAGE_KIND,
                    "Hub ledger only accepts DEPOSIT messages, got " + message.getKind().getValue());
            }
            if (message.getOriginDomain() != originDomain) {
                throw BridgeException.untrustedOrigin(message.getOriginDomain(), sender);
            }
            applyDeposit(messageId, message, config.getLocalDomain());
        } finally {
            lock.unlock();
        }
    }

    private void applyDeposit(String messageId, BridgeMessage message, int localDomain) {
        if (message.getAmount().signum() <= 0) {
            throw BridgeException.invalidAmount(message.getAmount());
        }
        if (Addresses.isZero(message.getRecipient())) {
            throw BridgeException.zeroAddress("deposit recipient");
        }

        TokenMapping mapping = tokenRegistry
            .getTokenMapping(message.getOriginDomain(), message.getToken(), localDomain)
            .filter(TokenMapping::isActive)
            .orElse(null);
        if (mapping == null) {
            log.error("UNMAPPED TOKEN: deposit {} of {} {} from domain {} for {} cannot be credited; "
                    + "collateral stays locked until a mapping is registered and the message is redelivered",
                messageId, message.getAmount(), message.getToken(), message.getOriginDomain(), message.getRecipient());
            throw new BridgeException(BridgeErrorCode.UNMAPPED_TOKEN, String.format(
                "No active token mapping for %d:%s -> %d", message.getOriginDomain(), message.getToken(), localDomain));
        }
        SyntheticAsset asset = requireAsset(mapping.getSyntheticToken());

        asset.mint(address, address, message.getAmount());
        userLedger.credit(message.getRecipient(), asset.getAddress(), message.getAmount());
        if (!processedMessages.markProcessed(messageId)) {
            // Another writer applied the same id; undo ours
            userLedger.debit(message.getRecipient(), asset.getAddress(), message.getAmount());
            asset.burn(address, address, message.getAmount());
            log.warn("Concurrent application of message {} detected, credit undone", messageId);
            return;
        }
        long count = userLedger.incrementProcessedCount(message.getRecipient());

        log.info("Deposit credited: id={}, origin={}, user={}, amount={} {}, sequence={}, userProcessed={}",
            messageId, message.getOriginDomain(), message.getRecipient(), message.getAmount(),
            asset.getSymbol(), message.getSequence(), count);
    }

    @Override
    public String requestWithdraw(String user, String syntheticToken, BigInteger amount, int targetDomain) {
        return requestWithdraw(user, syntheticToken, amount, targetDomain, user);
    }

    /**
     * Debit {@code user}, burn from custody, and dispatch a RELEASE to the gateway
     * registered for {@code targetDomain}.
     *
     * @return message id of the dispatched RELEASE
     */
    @Override
    public String requestWithdraw(String user, String syntheticToken, BigInteger amount, int targetDomain,
                                  String recipient) {
        lock.lock();
        try {
            CrossChainConfig config = requireConfigured();
            if (amount == null || amount.signum() <= 0) {
                throw BridgeException.invalidAmount(amount);
            }
            if (Addresses.isZero(user)) {
                throw BridgeException.zeroAddress("user");
            }
            if (Addresses.isZero(recipient)) {
                throw BridgeException.zeroAddress("recipient");
            }
            ChainEndpoint endpoint = chainRegistry.getActiveEndpoint(targetDomain)
                .orElseThrow(() -> new BridgeException(BridgeErrorCode.CHAIN_NOT_FOUND,
                    "No active gateway registered for domain " + targetDomain));
            SyntheticAsset asset = requireAsset(syntheticToken);

            userLedger.debit(user, asset.getAddress(), amount);
            asset.burn(address, address, amount);

            BigInteger sequence = releaseSequence;
            releaseSequence = sequence.add(BigInteger.ONE);
            BridgeMessage release = BridgeMessage.builder()
                .kind(MessageKind.RELEASE)
                .token(asset.getAddress())
                .recipient(Addresses.normalize(recipient))
                .amount(amount)
                .originDomain(config.getLocalDomain())
                .sequence(sequence)
                .build();

            String messageId;
            try {
                messageId = transport.dispatch(address, targetDomain, endpoint.getGatewayAddress(),
                    BridgeMessageCodec.encode(release));
            } catch (RuntimeException e) {
                asset.mint(address, address, amount);
                userLedger.credit(user, asset.getAddress(), amount);
                log.error("Withdrawal dispatch failed, debit and burn reverted: user={}, amount={} {}",
                    user, amount, asset.getSymbol(), e);
                if (e instanceof BridgeException) {
                    throw e;
                }
                throw new BridgeException(BridgeErrorCode.DISPATCH_FAILED, "Failed to dispatch withdrawal", e);
            }
            userLedger.incrementWithdrawNonce(user);

            log.info("Withdrawal dispatched: id={}, user={}, amount={} {}, target={}, gateway={}, recipient={}",
                messageId, user, amount, asset.getSymbol(), targetDomain, endpoint.getGatewayAddress(), recipient);
            return messageId;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ChainEndpoint setChainEndpoint(String caller, int domain, String gatewayAddress) {
        ownership.checkOwner(caller, "setChainEndpoint");
        return chainRegistry.setChainEndpoint(caller, domain, gatewayAddress);
    }

    @Override
    public void setTokenRegistry(String caller, TokenRegistry tokenRegistry) {
        ownership.checkOwner(caller, "setTokenRegistry");
        if (tokenRegistry == null) {
            throw BridgeException.zeroAddress("token registry");
        }
        lock.lock();
        try {
            this.tokenRegistry = tokenRegistry;
        } finally {
            lock.unlock();
        }
        log.info("Token registry replaced");
    }

    /**
     * Set the transport and local domain. May be called any number of times.
     */
    @Override
    public CrossChainConfig updateCrossChainConfig(String caller, MessageTransport transport, int localDomain) {
        ownership.checkOwner(caller, "updateCrossChainConfig");
        if (transport == null) {
            throw BridgeException.zeroAddress("transport");
        }
        CrossChainConfig config = CrossChainConfig.builder()
            .transportAddress(Addresses.normalize(transport.getAddress()))
            .localDomain(localDomain)
            .build();
        lock.lock();
        try {
            this.transport = transport;
            this.crossChainConfig = config;
        } finally {
            lock.unlock();
        }
        log.info("Cross-chain config updated: transport={}, localDomain={}", config.getTransportAddress(), localDomain);
        return config;
    }

    @Override
    public void transferOwnership(String caller, String newOwner) {
        ownership.transferOwnership(caller, newOwner);
    }

    @Override
    public BigInteger getBalance(String user, String asset) {
        return userLedger.balanceOf(user, asset);
    }

    @Override
    public boolean isMessageProcessed(String messageId) {
        return processedMessages.isProcessed(messageId);
    }

    @Override
    public Optional<ChainEndpoint> getChainEndpoint(int domain) {
        return chainRegistry.getChainEndpoint(domain);
    }

    @Override
    public Optional<CrossChainConfig> getCrossChainConfig() {
        return Optional.ofNullable(crossChainConfig);
    }

    @Override
    public long getUserProcessedCount(String user) {
        return userLedger.processedCount(user);
    }

    @Override
    public BigInteger getUserNonce(String user) {
        return userLedger.withdrawNonce(user);
    }

    @Override
    public BigInteger getTotalCredited(String asset) {
        return userLedger.totalCredited(asset);
    }

    @Override
    public String getOwner() {
        return ownership.getOwner();
    }

    /**
     * Sequence the next RELEASE will carry.
     */
    public BigInteger getReleaseSequence() {
        lock.lock();
        try {
            return releaseSequence;
        } finally {
            lock.unlock();
        }
    }

    public TokenRegistry getTokenRegistry() {
        return tokenRegistry;
    }

    public MessageTransport getTransport() {
        return transport;
    }

    private CrossChainConfig requireConfigured() {
        CrossChainConfig config = crossChainConfig;
        if (config == null || transport == null) {
            throw new BridgeException(BridgeErrorCode.NOT_CONFIGURED, "Hub ledger cross-chain config is not set");
        }
        return config;
    }

    private SyntheticAsset requireAsset(String syntheticToken) {
        return assetFactory.find(syntheticToken)
            .orElseThrow(() -> new BridgeException(BridgeErrorCode.SYNTHETIC_NOT_FOUND,
                "Unknown synthetic asset " + syntheticToken));
    }
}
