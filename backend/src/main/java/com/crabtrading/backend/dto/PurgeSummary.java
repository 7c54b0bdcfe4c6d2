package com.crabtrading.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PurgeSummary {
    private String accountId;
    private String displayName;
    private int removedApiKeys;
    private int removedNameMappings;
    private int removedChallenges;
    private int removedPendingRegistrations;
    private int removedRegistrationKeys;
    private int removedOutgoingFollows;
    private int removedIncomingFollows;
    private int removedActivityEvents;
    private int removedTestFlags;
}
