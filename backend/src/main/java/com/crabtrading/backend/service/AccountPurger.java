package com.crabtrading.backend.service;

import com.crabtrading.backend.dto.PurgeSummary;
import com.crabtrading.backend.model.Account;
import com.crabtrading.backend.model.ActivityEvent;
import com.crabtrading.backend.model.LedgerState;
import com.crabtrading.backend.model.RegistrationChallenge;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Removes every trace of one account from the ledger. Entries are matched by any alias the
 * account may appear under (id, current display name, the identifier the caller used) so
 * that legacy rows written before ids existed are also scrubbed.
 */
@Component
public class AccountPurger {

    /**
     * Caller must hold the ledger lock and must have resolved {@code accountId} to an existing
     * account.
     */
    public PurgeSummary purge(LedgerState state, String accountId, String identifier) {
        Account account = state.getAccounts().get(accountId);
        if (account == null) {
            throw new IllegalStateException("Purge target " + accountId + " does not exist");
        }
        Set<String> aliases = new LinkedHashSet<>();
        addAlias(aliases, accountId);
        addAlias(aliases, account.getDisplayName());
        addAlias(aliases, identifier);

        PurgeSummary.PurgeSummaryBuilder summary = PurgeSummary.builder()
                .accountId(accountId)
                .displayName(account.getDisplayName());

        Set<String> removedKeys = new HashSet<>();
        for (Iterator<Map.Entry<String, String>> it = state.getAgentKeys().entrySet().iterator(); it.hasNext(); ) {
            Map.Entry<String, String> entry = it.next();
            if (aliases.contains(entry.getKey())) {
                removedKeys.add(entry.getValue());
                it.remove();
            }
        }
        for (Iterator<Map.Entry<String, String>> it = state.getKeyToAgent().entrySet().iterator(); it.hasNext(); ) {
            Map.Entry<String, String> entry = it.next();
            if (aliases.contains(entry.getValue()) || removedKeys.contains(entry.getKey())) {
                removedKeys.add(entry.getKey());
                it.remove();
            }
        }
        summary.removedApiKeys(removedKeys.size());

        int nameMappings = 0;
        for (Iterator<Map.Entry<String, String>> it = state.getNameIndex().entrySet().iterator(); it.hasNext(); ) {
            Map.Entry<String, String> entry = it.next();
            if (aliases.contains(entry.getKey()) || aliases.contains(entry.getValue())) {
                it.remove();
                nameMappings++;
            }
        }
        summary.removedNameMappings(nameMappings);

        Set<String> removedTokens = new HashSet<>();
        for (Iterator<RegistrationChallenge> it = state.getRegistrationChallenges().values().iterator(); it.hasNext(); ) {
            RegistrationChallenge challenge = it.next();
            if (aliases.contains(challenge.getAccountId()) || aliases.contains(challenge.getDisplayName())
                    || removedKeys.contains(challenge.getApiKey())) {
                removedTokens.add(challenge.getClaimToken());
                it.remove();
            }
        }
        summary.removedChallenges(removedTokens.size());

        int pending = 0;
        for (Iterator<Map.Entry<String, String>> it = state.getPendingByName().entrySet().iterator(); it.hasNext(); ) {
            Map.Entry<String, String> entry = it.next();
            if (aliases.contains(entry.getKey()) || removedTokens.contains(entry.getValue())) {
                removedTokens.add(entry.getValue());
                state.getRegistrationChallenges().remove(entry.getValue());
                it.remove();
                pending++;
            }
        }
        summary.removedPendingRegistrations(pending);

        int registrationKeys = 0;
        for (Iterator<Map.Entry<String, String>> it = state.getRegistrationByApiKey().entrySet().iterator(); it.hasNext(); ) {
            Map.Entry<String, String> entry = it.next();
            if (removedKeys.contains(entry.getKey()) || removedTokens.contains(entry.getValue())) {
                it.remove();
                registrationKeys++;
            }
        }
        summary.removedRegistrationKeys(registrationKeys);

        int outgoing = 0;
        for (String alias : aliases) {
            List<String> targets = state.getFollowing().remove(alias);
            if (targets != null) {
                outgoing += targets.size();
            }
        }
        summary.removedOutgoingFollows(outgoing);

        int incoming = 0;
        for (Iterator<Map.Entry<String, List<String>>> it = state.getFollowing().entrySet().iterator(); it.hasNext(); ) {
            List<String> targets = it.next().getValue();
            int before = targets.size();
            targets.removeIf(aliases::contains);
            incoming += before - targets.size();
            if (targets.isEmpty()) {
                it.remove();
            }
        }
        summary.removedIncomingFollows(incoming);

        int events = 0;
        for (Iterator<ActivityEvent> it = state.getActivityLog().iterator(); it.hasNext(); ) {
            ActivityEvent event = it.next();
            if (isActor(event, aliases, state)) {
                it.remove();
                events++;
            }
        }
        summary.removedActivityEvents(events);

        int testFlags = 0;
        for (String alias : aliases) {
            if (state.getTestAccounts().remove(alias)) {
                testFlags++;
            }
        }
        summary.removedTestFlags(testFlags);

        state.getAccounts().remove(accountId);
        return summary.build();
    }

    private boolean isActor(ActivityEvent event, Set<String> aliases, LedgerState state) {
        String eventAccountId = event.getAccountId();
        if (eventAccountId != null && !eventAccountId.isBlank()) {
            return aliases.contains(eventAccountId);
        }
        String cachedName = event.getDisplayName();
        if (cachedName == null) {
            return false;
        }
        if (aliases.contains(cachedName)) {
            return true;
        }
        return state.resolveAccountId(cachedName).map(aliases::contains).orElse(false);
    }

    private void addAlias(Set<String> aliases, String value) {
        if (value != null && !value.isBlank()) {
            aliases.add(value.trim());
        }
    }
}
