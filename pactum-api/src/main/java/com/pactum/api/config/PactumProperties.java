package com.pactum.api.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Externalized protocol configuration under {@code pactum.*}.
 */
@Validated
@ConfigurationProperties(prefix = "pactum")
public class PactumProperties {

    @Valid
    private Pin pin = new Pin();

    @Valid
    private Audit audit = new Audit();

    public Pin getPin() { return pin; }
    public void setPin(Pin pin) { this.pin = pin; }
    public Audit getAudit() { return audit; }
    public void setAudit(Audit audit) { this.audit = audit; }

    /**
     * Resolves the bound values into the settings the services take.
     */
    public ProtocolSettings toSettings() {
        return new ProtocolSettings(
                pin.getSigningKey(),
                Duration.ofSeconds(pin.getTtlSeconds()),
                audit.getDefaultPageSize(),
                audit.getMaxPageSize());
    }

    public static class Pin {

        @NotBlank
        @Size(min = ProtocolSettings.MIN_SIGNING_KEY_LENGTH)
        private String signingKey;

        @Positive
        private long ttlSeconds = 60;

        public String getSigningKey() { return signingKey; }
        public void setSigningKey(String signingKey) { this.signingKey = signingKey; }
        public long getTtlSeconds() { return ttlSeconds; }
        public void setTtlSeconds(long ttlSeconds) { this.ttlSeconds = ttlSeconds; }
    }

    public static class Audit {

        @Positive
        private int defaultPageSize = 100;

        @Positive
        @Max(10_000)
        private int maxPageSize = 1000;

        public int getDefaultPageSize() { return defaultPageSize; }
        public void setDefaultPageSize(int defaultPageSize) { this.defaultPageSize = defaultPageSize; }
        public int getMaxPageSize() { return maxPageSize; }
        public void setMaxPageSize(int maxPageSize) { this.maxPageSize = maxPageSize; }
    }
}
