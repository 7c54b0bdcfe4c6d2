package com.crabtrading.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A pending (or claimed) registration. The account id and API key are reserved when the
 * challenge is issued and become live once the claim completes.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RegistrationChallenge {
    private String claimToken;
    private String accountId;
    private String displayName;
    private String description;
    private String challengeCode;
    private String apiKey;
    private long expiresAt;
    private boolean claimed;
    private String claimedAt;
    private boolean test;
}
