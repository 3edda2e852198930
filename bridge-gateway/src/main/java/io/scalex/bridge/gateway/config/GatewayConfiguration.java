package io.scalex.bridge.gateway.config;

import io.scalex.bridge.gateway.SourceGatewayService;
import io.scalex.bridge.kafka.KafkaConfig;
import io.scalex.bridge.mailbox.MailboxConfiguration;
import io.scalex.bridge.mailbox.MailboxDelivery;
import io.scalex.bridge.mailbox.MessageTransport;
import io.scalex.bridge.mailbox.ParkedDeliveryController;
import io.scalex.bridge.store.InMemoryProcessedMessageStore;
import io.scalex.bridge.token.TokenDirectory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

/**
 * Source gateway wiring.
 * 
 * Configuration Properties:
 * - bridge.gateway.address: address of this gateway (custody account)
 * - bridge.owner: gateway owner
 * - bridge.local-domain: domain of this side network
 * - bridge.hub.domain / bridge.hub.address: the hub ledger this gateway reports to
 */
@Configuration
@Import({MailboxConfiguration.class, KafkaConfig.class, ParkedDeliveryController.class})
public class GatewayConfiguration {

    @Value("${bridge.gateway.address}")
    private String gatewayAddress;

    @Value("${bridge.owner}")
    private String owner;

    @Value("${bridge.local-domain}")
    private int localDomain;

    @Value("${bridge.hub.domain}")
    private int hubDomain;

    @Value("${bridge.hub.address}")
    private String hubAddress;

    @Bean
    public TokenDirectory tokenDirectory() {
        return new TokenDirectory();
    }

    @Bean
    public SourceGatewayService sourceGateway(TokenDirectory tokenDirectory, MessageTransport messageTransport,
                                              MailboxDelivery mailboxDelivery) {
        SourceGatewayService gateway = new SourceGatewayService(gatewayAddress, owner, tokenDirectory,
            new InMemoryProcessedMessageStore());
        gateway.updateCrossChainConfig(owner, messageTransport, localDomain, hubDomain, hubAddress);
        mailboxDelivery.register(gateway);
        return gateway;
    }
}
