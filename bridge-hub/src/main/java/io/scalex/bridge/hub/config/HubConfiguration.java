package io.scalex.bridge.hub.config;

import io.scalex.bridge.hub.asset.SyntheticAssetFactory;
import io.scalex.bridge.hub.ledger.HubLedgerService;
import io.scalex.bridge.hub.ledger.UserLedger;
import io.scalex.bridge.hub.registry.ChainRegistry;
import io.scalex.bridge.hub.registry.TokenRegistry;
import io.scalex.bridge.kafka.KafkaConfig;
import io.scalex.bridge.mailbox.MailboxConfiguration;
import io.scalex.bridge.mailbox.MailboxDelivery;
import io.scalex.bridge.mailbox.MessageTransport;
import io.scalex.bridge.mailbox.ParkedDeliveryController;
import io.scalex.bridge.store.InMemoryProcessedMessageStore;
import io.scalex.bridge.store.ProcessedMessageStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

/**
 * Hub service wiring.
 * 
 * Registries are plain owned objects created here and passed to the ledger by
 * reference; nothing is looked up statically.
 * 
 * Configuration Properties:
 * - bridge.hub.address: address of the hub ledger (minter of every synthetic asset)
 * - bridge.owner: owner of the ledger, the registries and the asset factory
 * - bridge.local-domain: hub domain
 */
@Configuration
@Import({MailboxConfiguration.class, KafkaConfig.class, ParkedDeliveryController.class})
public class HubConfiguration {

    @Value("${bridge.hub.address}")
    private String hubAddress;

    @Value("${bridge.owner}")
    private String owner;

    @Value("${bridge.local-domain}")
    private int localDomain;

    @Bean
    public ChainRegistry chainRegistry() {
        return new ChainRegistry(owner);
    }

    @Bean
    public TokenRegistry tokenRegistry() {
        return new TokenRegistry(owner);
    }

    @Bean
    public SyntheticAssetFactory syntheticAssetFactory() {
        return new SyntheticAssetFactory(owner, hubAddress);
    }

    @Bean
    public ProcessedMessageStore processedMessageStore() {
        return new InMemoryProcessedMessageStore();
    }

    @Bean
    public UserLedger userLedger() {
        return new UserLedger();
    }

    @Bean
    public HubLedgerService hubLedger(ChainRegistry chainRegistry, TokenRegistry tokenRegistry,
                                      SyntheticAssetFactory syntheticAssetFactory,
                                      ProcessedMessageStore processedMessageStore, UserLedger userLedger,
                                      MessageTransport messageTransport, MailboxDelivery mailboxDelivery) {
        HubLedgerService ledger = new HubLedgerService(hubAddress, owner, chainRegistry, tokenRegistry,
            syntheticAssetFactory, processedMessageStore, userLedger);
        ledger.updateCrossChainConfig(owner, messageTransport, localDomain);
        mailboxDelivery.register(ledger);
        return ledger;
    }
}
