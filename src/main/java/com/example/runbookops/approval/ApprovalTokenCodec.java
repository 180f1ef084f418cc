package com.example.runbookops.approval;

import com.example.runbookops.config.RunbookOpsProperties;
import com.example.runbookops.exception.InvalidApprovalTokenException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Signs and verifies approval tokens.
 *
 * <p>The payload is JSON encoded as base64url without padding; the signature is the hex
 * HMAC-SHA256 of that encoded string. Verification fails closed: any decoding problem,
 * signature mismatch, expiry or execId mismatch raises {@link InvalidApprovalTokenException}
 * with the same message.
 */
@Slf4j
@Component
public class ApprovalTokenCodec {

    private static final String ALGORITHM = "HmacSHA256";

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final SecretKeySpec key;

    public ApprovalTokenCodec(RunbookOpsProperties properties, ObjectMapper objectMapper, Clock clock) {
        String secret = properties.getApproval().getSecret();
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("runbook-ops.approval.secret must be set");
        }
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
    }

    public SignedApprovalToken sign(ApprovalToken token) {
        try {
            byte[] json = objectMapper.writeValueAsBytes(token);
            String payload = Base64.getUrlEncoder().withoutPadding().encodeToString(json);
            return new SignedApprovalToken(payload, signature(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode approval token", e);
        }
    }

    /**
     * Verifies signature, expiry and that the token belongs to {@code routeExecId}, in that order.
     */
    public ApprovalToken verify(String routeExecId, String payload, String signature) {
        if (payload == null || signature == null) {
            throw new InvalidApprovalTokenException();
        }
        byte[] expected = signature(payload).getBytes(StandardCharsets.US_ASCII);
        byte[] provided = signature.trim().toLowerCase().getBytes(StandardCharsets.US_ASCII);
        if (!MessageDigest.isEqual(expected, provided)) {
            log.debug("[{}] Approval signature mismatch", routeExecId);
            throw new InvalidApprovalTokenException();
        }

        ApprovalToken token;
        try {
            token = objectMapper.readValue(Base64.getUrlDecoder().decode(payload), ApprovalToken.class);
        } catch (Exception e) {
            log.debug("[{}] Approval payload undecodable: {}", routeExecId, e.getMessage());
            throw new InvalidApprovalTokenException();
        }

        Instant exp;
        try {
            exp = Instant.parse(token.getExp() == null ? "" : token.getExp());
        } catch (DateTimeParseException e) {
            log.debug("[{}] Approval payload has no valid exp", routeExecId);
            throw new InvalidApprovalTokenException();
        }
        if (!clock.instant().isBefore(exp)) {
            log.debug("[{}] Approval token expired at {}", routeExecId, exp);
            throw new InvalidApprovalTokenException();
        }
        if (token.getExecId() == null || !token.getExecId().equals(routeExecId)) {
            log.debug("[{}] Approval token issued for another execution", routeExecId);
            throw new InvalidApprovalTokenException();
        }
        return token;
    }

    private String signature(String payload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.US_ASCII)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}
