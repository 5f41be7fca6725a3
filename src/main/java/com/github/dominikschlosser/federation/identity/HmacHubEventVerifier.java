package com.github.dominikschlosser.federation.identity;

import com.github.dominikschlosser.federation.RejectionReason;
import com.github.dominikschlosser.federation.representations.HubLoginEventRepresentation;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.UUID;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.jboss.logging.Logger;
import org.keycloak.common.util.Base64Url;
import org.keycloak.util.JsonSerialization;

/**
 * Verifies hub login events signed with a shared HMAC key.
 *
 * <p>Wire format:
 *
 * <pre>
 * payload   = JSON {subject, attributes, groups, issuedAt, traceId}
 * signature = Base64Url(HMAC-SHA256(payload))
 * </pre>
 *
 * <p>The comparison is constant-time. A missing trace id is replaced with a generated one so that
 * every downstream audit record can still be correlated.
 */
public class HmacHubEventVerifier implements HubEventVerifier {

    private static final Logger logger = Logger.getLogger(HmacHubEventVerifier.class);

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final byte[] hubKey;

    public HmacHubEventVerifier(byte[] hubKey) {
        if (hubKey == null || hubKey.length == 0) {
            throw new IllegalArgumentException("Hub key must not be empty");
        }
        this.hubKey = hubKey.clone();
    }

    @Override
    public CanonicalIdentity verify(SignedHubEvent event) {
        if (event == null || isEmpty(event.getPayload()) || isEmpty(event.getSignature())) {
            throw new EventVerificationException(RejectionReason.INVALID_EVENT, "Hub event is null or empty");
        }

        byte[] expected = computeHmac(event.getPayload(), hubKey);
        byte[] actual;
        try {
            actual = Base64Url.decode(event.getSignature());
        } catch (RuntimeException e) {
            throw new EventVerificationException(
                    RejectionReason.INVALID_EVENT, "Hub event signature is not Base64Url", e);
        }

        if (!MessageDigest.isEqual(expected, actual)) {
            throw new EventVerificationException(
                    RejectionReason.INVALID_EVENT, "Hub event signature verification failed");
        }

        HubLoginEventRepresentation rep;
        try {
            rep = JsonSerialization.readValue(event.getPayload(), HubLoginEventRepresentation.class);
        } catch (IOException e) {
            throw new EventVerificationException(
                    RejectionReason.INVALID_EVENT, "Hub event payload is not valid JSON", e);
        }
        if (rep == null) {
            throw new EventVerificationException(RejectionReason.INVALID_EVENT, "Hub event payload is empty");
        }

        return toIdentity(rep);
    }

    /** Signs a payload the way the hub does. Used by hub-side tooling and tests. */
    public static String sign(String payload, byte[] hubKey) {
        return Base64Url.encode(computeHmac(payload, hubKey));
    }

    private CanonicalIdentity toIdentity(HubLoginEventRepresentation rep) {
        if (isEmpty(rep.getSubject())) {
            throw new EventVerificationException(RejectionReason.INVALID_EVENT, "Hub event has no subject");
        }
        if (isEmpty(rep.getIssuedAt())) {
            throw new EventVerificationException(RejectionReason.INVALID_EVENT, "Hub event has no issuance time");
        }

        Instant issuedAt;
        try {
            issuedAt = Instant.parse(rep.getIssuedAt());
        } catch (DateTimeParseException e) {
            throw new EventVerificationException(
                    RejectionReason.INVALID_EVENT, "Hub event issuance time is not ISO-8601: " + rep.getIssuedAt(), e);
        }

        String traceId = rep.getTraceId();
        if (isEmpty(traceId)) {
            traceId = UUID.randomUUID().toString();
            logger.debugf("Hub event for subject %s carried no trace id, generated %s", rep.getSubject(), traceId);
        }

        return CanonicalIdentity.builder(rep.getSubject())
                .attributes(rep.getAttributes())
                .groups(rep.getGroups())
                .issuedAt(issuedAt)
                .traceId(traceId)
                .build();
    }

    private static byte[] computeHmac(String data, byte[] key) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(key, HMAC_ALGORITHM));
            return mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new RuntimeException("Failed to compute HMAC", e);
        }
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
