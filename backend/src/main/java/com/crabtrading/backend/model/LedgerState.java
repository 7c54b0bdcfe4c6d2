package com.crabtrading.backend.model;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Everything the ledger keeps in memory. Not thread-safe: callers hold the store lock for
 * every access.
 */
@Getter
public class LedgerState {

    private final Map<String, Account> accounts = new LinkedHashMap<>();
    private final Map<String, String> nameIndex = new LinkedHashMap<>();
    private final Map<String, String> agentKeys = new LinkedHashMap<>();
    private final Map<String, String> keyToAgent = new LinkedHashMap<>();
    private final Map<String, RegistrationChallenge> registrationChallenges = new LinkedHashMap<>();
    private final Map<String, String> pendingByName = new LinkedHashMap<>();
    private final Map<String, String> registrationByApiKey = new LinkedHashMap<>();
    private final Map<String, List<String>> following = new LinkedHashMap<>();
    private final Set<String> testAccounts = new LinkedHashSet<>();
    private final List<ActivityEvent> activityLog = new ArrayList<>();
    private final Map<String, Double> prices = new LinkedHashMap<>();
    private final Map<String, PredictionMarket> markets = new LinkedHashMap<>();

    @Setter
    private long nextActivityId = 1;

    public Optional<Account> account(String accountId) {
        if (accountId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(accounts.get(accountId));
    }

    /**
     * Resolves an account id or a current display name to the account id.
     */
    public Optional<String> resolveAccountId(String identifier) {
        if (identifier == null) {
            return Optional.empty();
        }
        String key = identifier.trim();
        if (key.isEmpty()) {
            return Optional.empty();
        }
        if (accounts.containsKey(key)) {
            return Optional.of(key);
        }
        String byName = nameIndex.get(key);
        if (byName != null && accounts.containsKey(byName)) {
            return Optional.of(byName);
        }
        return Optional.empty();
    }

    public Optional<Double> lastPrice(String symbol) {
        Double price = prices.get(symbol);
        return price != null && price > 0 ? Optional.of(price) : Optional.empty();
    }

    public long allocateActivityId() {
        return nextActivityId++;
    }
}
