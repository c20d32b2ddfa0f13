package com.pactum.api.config;

import com.pactum.api.audit.AuditChain;
import com.pactum.api.contract.ContractLedger;
import com.pactum.api.crypto.CryptoVerifier;
import com.pactum.api.pin.PinIssuer;
import com.pactum.api.pin.PinSigner;
import com.pactum.api.pin.PinValidator;
import com.pactum.core.repository.memory.InMemoryAuditLogRepository;
import com.pactum.core.repository.memory.InMemoryContractRepository;
import com.pactum.core.repository.memory.InMemoryPinRepository;
import com.pactum.core.repository.memory.InMemoryTransactionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;

/**
 * Wires the consent protocol services over the in-process store.
 * A hosting transport imports this configuration and calls the service beans.
 */
@Configuration
@EnableConfigurationProperties(PactumProperties.class)
public class ConsentProtocolConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ConsentProtocolConfiguration.class);

    @Bean
    public ProtocolSettings protocolSettings(PactumProperties properties) {
        ProtocolSettings settings = properties.toSettings();
        log.info("Consent protocol configured: {}", settings);
        return settings;
    }

    @Bean
    public Clock protocolClock() {
        return Clock.systemUTC();
    }

    @Bean
    public SecureRandom protocolRandom() {
        return new SecureRandom();
    }

    @Bean
    public InMemoryTransactionManager protocolTransactionManager() {
        return new InMemoryTransactionManager();
    }

    @Bean
    public InMemoryContractRepository contractRepository(InMemoryTransactionManager transactions) {
        return new InMemoryContractRepository(transactions);
    }

    @Bean
    public InMemoryPinRepository pinRepository(InMemoryTransactionManager transactions) {
        return new InMemoryPinRepository(transactions);
    }

    @Bean
    public InMemoryAuditLogRepository auditLogRepository(InMemoryTransactionManager transactions) {
        return new InMemoryAuditLogRepository(transactions);
    }

    @Bean
    public CryptoVerifier cryptoVerifier() {
        return new CryptoVerifier();
    }

    @Bean
    public PinSigner pinSigner(ProtocolSettings settings) {
        return new PinSigner(settings.pinSigningKey());
    }

    @Bean
    public ContractLedger contractLedger(
            InMemoryTransactionManager transactions,
            InMemoryContractRepository contracts,
            CryptoVerifier crypto,
            Clock clock) {
        return new ContractLedger(transactions, contracts, crypto, clock);
    }

    @Bean
    public PinIssuer pinIssuer(
            InMemoryTransactionManager transactions,
            InMemoryContractRepository contracts,
            InMemoryPinRepository pins,
            PinSigner signer,
            SecureRandom random,
            Clock clock,
            ProtocolSettings settings) {
        return new PinIssuer(transactions, contracts, pins, signer, random, clock, settings);
    }

    @Bean
    public PinValidator pinValidator(
            InMemoryTransactionManager transactions,
            InMemoryPinRepository pins,
            InMemoryContractRepository contracts,
            PinSigner signer,
            Clock clock) {
        return new PinValidator(transactions, pins, contracts, signer, clock);
    }

    @Bean
    public AuditChain auditChain(
            InMemoryTransactionManager transactions,
            InMemoryAuditLogRepository entries,
            Clock clock,
            ProtocolSettings settings) {
        return new AuditChain(transactions, entries, clock, settings);
    }
}
