package com.pactum.api.pin;

import com.pactum.api.support.ProtocolFixture;
import com.pactum.core.domain.Contract;
import com.pactum.core.domain.Pin;
import com.pactum.core.domain.Scope;
import com.pactum.core.result.ErrorKind;
import com.pactum.core.result.ProtocolResult;
import net.jqwik.api.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * Property tests for PIN issuance and revocation.
 */
class PinIssuerPropertyTest {

    private static final String ACME = "system:acme";
    private static final String SCHEDULER = "agent:scheduler";

    /**
     * Property: any subset of the contract scope can be issued.
     */
    @Property(tries = 50)
    void subsetScopesAreIssued(
            @ForAll("names") Set<String> dataTypes,
            @ForAll("names") Set<String> actions,
            @ForAll("masks") List<Boolean> mask) {
        ProtocolFixture fixture = new ProtocolFixture();
        Contract contract = fixture.active(ACME, SCHEDULER, ProtocolFixture.terms(dataTypes, actions));
        Scope requested = Scope.of(pick(dataTypes, mask), pick(actions, mask));

        ProtocolResult<IssuedPin> result = fixture.issuer.createPin(SCHEDULER, contract.id(), requested, true);

        assertThat(result.isOk()).isTrue();
        assertThat(result.value().pin().scope()).isEqualTo(requested);
    }

    /**
     * Property: a scope reaching past the contract in either dimension is refused.
     */
    @Property(tries = 50)
    void supersetScopesAreRefused(
            @ForAll("names") Set<String> dataTypes,
            @ForAll("names") Set<String> actions,
            @ForAll boolean extraDataType) {
        ProtocolFixture fixture = new ProtocolFixture();
        Contract contract = fixture.active(ACME, SCHEDULER, ProtocolFixture.terms(dataTypes, actions));
        List<String> requestedTypes = new ArrayList<>(dataTypes);
        List<String> requestedActions = new ArrayList<>(actions);
        (extraDataType ? requestedTypes : requestedActions).add("not-granted");

        ProtocolResult<IssuedPin> result = fixture.issuer.createPin(SCHEDULER, contract.id(),
                Scope.of(requestedTypes, requestedActions), true);

        assertThat(result.hasError(ErrorKind.SCOPE_EXCEEDED)).isTrue();
    }

    @Example
    void credentialCarriesTokenAndStoredSignature() {
        ProtocolFixture fixture = new ProtocolFixture();
        Contract contract = fixture.active(ACME, SCHEDULER, ProtocolFixture.terms(Set.of("appointment"), Set.of("read")));

        IssuedPin issued = fixture.issuer.createPin(SCHEDULER, contract.id(),
                Scope.of(List.of("appointment"), List.of("read")), true).value();

        PinCredential credential = PinCredential.parse(issued.credential()).orElseThrow();
        assertThat(credential.token()).hasSize(43).matches("[A-Za-z0-9_-]+");
        assertThat(credential.signature()).isEqualTo(issued.pin().signature()).hasSize(44);
        assertThat(fixture.signer.sign(issued.pin().id(), credential.token())).isEqualTo(credential.signature());
        assertThat(issued.pin().expiresAt()).isEqualTo(issued.pin().issuedAt().plusSeconds(60));
        assertThat(issued.toString()).doesNotContain(credential.token());
    }

    @Example
    void customTtlMustBePositive() {
        ProtocolFixture fixture = new ProtocolFixture();
        Contract contract = fixture.active(ACME, SCHEDULER, ProtocolFixture.terms(Set.of("appointment"), Set.of("read")));
        Scope scope = Scope.of(List.of("appointment"), List.of("read"));

        Pin pin = fixture.issuer.createPin(SCHEDULER, contract.id(), scope, false, Duration.ofMinutes(5)).value().pin();

        assertThat(Duration.between(pin.issuedAt(), pin.expiresAt())).isEqualTo(Duration.ofMinutes(5));
        assertThat(fixture.issuer.createPin(SCHEDULER, contract.id(), scope, false, Duration.ZERO)
                .hasError(ErrorKind.INVALID_REQUEST)).isTrue();
    }

    @Example
    void issuanceRequiresActiveContractAndParty() {
        ProtocolFixture fixture = new ProtocolFixture();
        Scope scope = Scope.of(List.of("appointment"), List.of("read"));
        Contract proposed = fixture.proposed(ACME, SCHEDULER, ProtocolFixture.terms(Set.of("appointment"), Set.of("read")));
        Contract active = fixture.active(ACME, SCHEDULER, ProtocolFixture.terms(Set.of("appointment"), Set.of("read")));

        assertThat(fixture.issuer.createPin(SCHEDULER, proposed.id(), scope, true).hasError(ErrorKind.INVALID_STATE)).isTrue();
        assertThat(fixture.issuer.createPin(SCHEDULER, UUID.randomUUID(), scope, true).hasError(ErrorKind.INVALID_STATE)).isTrue();
        assertThat(fixture.issuer.createPin("agent:mallory", active.id(), scope, true).hasError(ErrorKind.FORBIDDEN)).isTrue();

        fixture.ledger.revoke(active.id(), ACME, "done").value();
        assertThat(fixture.issuer.createPin(SCHEDULER, active.id(), scope, true).hasError(ErrorKind.INVALID_STATE)).isTrue();
    }

    @Example
    void blankScopeEntriesAreRejected() {
        ProtocolFixture fixture = new ProtocolFixture();
        Contract contract = fixture.active(ACME, SCHEDULER, ProtocolFixture.terms(Set.of("appointment"), Set.of("read")));

        assertThat(fixture.issuer.createPin(SCHEDULER, contract.id(),
                Scope.of(Arrays.asList("appointment", null), List.of("read")), true)
                .hasError(ErrorKind.INVALID_REQUEST)).isTrue();
        assertThat(fixture.issuer.createPin(SCHEDULER, contract.id(),
                Scope.of(List.of("appointment"), List.of(" ")), true)
                .hasError(ErrorKind.INVALID_REQUEST)).isTrue();
    }

    @Example
    void holderOrPartyMayRevoke() {
        ProtocolFixture fixture = new ProtocolFixture();
        Contract contract = fixture.active(ACME, SCHEDULER, ProtocolFixture.terms(Set.of("appointment"), Set.of("read")));
        Scope scope = Scope.of(List.of("appointment"), List.of("read"));
        Pin first = fixture.issuer.createPin(SCHEDULER, contract.id(), scope, true).value().pin();
        Pin second = fixture.issuer.createPin(SCHEDULER, contract.id(), scope, true).value().pin();

        assertThat(fixture.issuer.revokePin(first.id(), "agent:mallory", "stop").hasError(ErrorKind.FORBIDDEN)).isTrue();

        Pin revokedByHolder = fixture.issuer.revokePin(first.id(), SCHEDULER, "lost").value();
        assertThat(revokedByHolder.revoked()).isTrue();
        assertThat(revokedByHolder.revocationReason()).isEqualTo("lost");
        assertThat(fixture.issuer.revokePin(first.id(), SCHEDULER, "again").hasError(ErrorKind.NOT_FOUND)).isTrue();

        assertThat(fixture.issuer.revokePin(second.id(), ACME, "party revoke").isOk()).isTrue();
        assertThat(fixture.issuer.getPin(second.id()).value().revoked()).isTrue();
        assertThat(fixture.issuer.getPin(UUID.randomUUID()).hasError(ErrorKind.NOT_FOUND)).isTrue();
    }

    @Provide
    Arbitrary<Set<String>> names() {
        return Arbitraries.strings().withCharRange('a', 'z').ofMinLength(1).ofMaxLength(8)
                .set().ofMinSize(1).ofMaxSize(5);
    }

    @Provide
    Arbitrary<List<Boolean>> masks() {
        return Arbitraries.of(true, false).list().ofSize(5);
    }

    private static List<String> pick(Set<String> values, List<Boolean> mask) {
        List<String> picked = new ArrayList<>();
        int i = 0;
        for (String value : values) {
            if (mask.get(i++)) {
                picked.add(value);
            }
        }
        return picked;
    }
}
