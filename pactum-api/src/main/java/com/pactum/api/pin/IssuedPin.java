package com.pactum.api.pin;

import com.pactum.core.domain.Pin;

/**
 * A freshly issued PIN together with its credential. The credential is only ever available here.
 */
public record IssuedPin(Pin pin, String credential) {

    @Override
    public String toString() {
        return "IssuedPin[pin=" + pin.id() + ", expiresAt=" + pin.expiresAt() + "]";
    }
}
