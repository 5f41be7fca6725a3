package com.github.dominikschlosser.federation.identity;

/** A login event as delivered by the identity hub: the JSON claims payload and its signature. */
public final class SignedHubEvent {

    private final String payload;
    private final String signature;

    public SignedHubEvent(String payload, String signature) {
        this.payload = payload;
        this.signature = signature;
    }

    public String getPayload() {
        return payload;
    }

    public String getSignature() {
        return signature;
    }
}
