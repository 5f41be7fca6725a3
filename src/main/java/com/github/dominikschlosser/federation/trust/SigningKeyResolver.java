package com.github.dominikschlosser.federation.trust;

/** Answers whether a signing-key reference names a key the signing collaborator holds. */
@FunctionalInterface
public interface SigningKeyResolver {

    boolean isResolvable(String signingKeyRef);
}
