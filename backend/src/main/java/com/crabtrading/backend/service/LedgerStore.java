package com.crabtrading.backend.service;

import com.crabtrading.backend.config.LedgerProperties;
import com.crabtrading.backend.dto.AccountRegistration;
import com.crabtrading.backend.dto.LedgerResult;
import com.crabtrading.backend.dto.PurgeSummary;
import com.crabtrading.backend.exception.LedgerErrorCode;
import com.crabtrading.backend.model.Account;
import com.crabtrading.backend.model.ActivityEvent;
import com.crabtrading.backend.model.ActivityType;
import com.crabtrading.backend.model.LedgerState;
import com.crabtrading.backend.model.PredictionMarket;
import com.crabtrading.backend.model.RegistrationChallenge;
import com.crabtrading.backend.service.persistence.LedgerPersistenceService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Owns the in-memory ledger and the single lock that guards it.
 * <p>
 * Every read-modify-write runs inside {@link #withLock}; mutations end with {@link #commit()},
 * which writes the snapshot before the lock is released. Market-data calls must never be made
 * while the lock is held.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LedgerStore {

    private static final Pattern DISPLAY_NAME = Pattern.compile("^[A-Za-z0-9_\\-]{3,64}$");
    private static final Pattern TEST_TAG =
            Pattern.compile("(?:^|[_\\-\\s])(test|demo|sandbox|qa|staging|smoke|e2e|debug|persist)(?:$|[_\\-\\s])");
    public static final String ADMIN_ACTOR = "@admin";

    private final LedgerPersistenceService persistenceService;
    private final LedgerProperties ledgerProperties;
    private final AccountPurger accountPurger;
    private final LedgerMetrics ledgerMetrics;

    private final ReentrantLock lock = new ReentrantLock();
    private final SecureRandom secureRandom = new SecureRandom();
    private LedgerState state = new LedgerState();

    public record Stats(int accounts, int markets, int activityEvents, int pricedSymbols) {
    }

    @PostConstruct
    void restore() {
        LedgerState loaded = persistenceService.load();
        lock.lock();
        try {
            state = loaded;
            applySeeds();
            ledgerMetrics.updateAccountCount(state.getAccounts().size());
            log.info("Ledger restored accounts={} events={} nextActivityId={}",
                    state.getAccounts().size(), state.getActivityLog().size(), state.getNextActivityId());
        } finally {
            lock.unlock();
        }
    }

    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runLocked(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Live ledger state. Only valid while the caller holds the lock.
     */
    public LedgerState state() {
        requireLocked();
        return state;
    }

    /**
     * Synchronously persists the current state. Must be called with the lock held so the
     * snapshot reflects a consistent ledger.
     */
    public void commit() {
        requireLocked();
        persistenceService.save(state);
        ledgerMetrics.updateAccountCount(state.getAccounts().size());
    }

    public Optional<String> resolve(String identifier) {
        return withLock(() -> state.resolveAccountId(identifier));
    }

    public Optional<String> resolveApiKey(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            return Optional.empty();
        }
        return withLock(() -> {
            String accountId = state.getKeyToAgent().get(apiKey.trim());
            return accountId != null && state.getAccounts().containsKey(accountId)
                    ? Optional.of(accountId)
                    : Optional.<String>empty();
        });
    }

    public LedgerResult<AccountRegistration> createAccount(String displayName) {
        return createAccount(displayName, ledgerProperties.getStartingCash(), false);
    }

    public LedgerResult<AccountRegistration> createAccount(String displayName, double startingCash, boolean test) {
        return withLock(() -> {
            LedgerResult<AccountRegistration> result = openAccount(UUID.randomUUID().toString(), displayName,
                    newApiKey(), startingCash, test, "", "direct");
            if (result.isOk()) {
                commit();
            }
            return result;
        });
    }

    public LedgerResult<RegistrationChallenge> issueRegistration(String displayName, String description) {
        return issueRegistration(displayName, description, Instant.now());
    }

    LedgerResult<RegistrationChallenge> issueRegistration(String displayName, String description, Instant now) {
        return withLock(() -> {
            String name = normalizeName(displayName);
            if (!DISPLAY_NAME.matcher(name).matches()) {
                return LedgerResult.<RegistrationChallenge>reject(LedgerErrorCode.INVALID_DISPLAY_NAME);
            }
            if (isNameTaken(name, null)) {
                return LedgerResult.<RegistrationChallenge>reject(LedgerErrorCode.NAME_ALREADY_EXISTS);
            }
            String existingToken = state.getPendingByName().get(name);
            if (existingToken != null) {
                RegistrationChallenge existing = state.getRegistrationChallenges().get(existingToken);
                if (existing != null && !existing.isClaimed() && existing.getExpiresAt() >= now.getEpochSecond()) {
                    return LedgerResult.ok(existing.toBuilder().build());
                }
            }
            String cleanDescription = description == null ? "" : description.trim();
            RegistrationChallenge challenge = RegistrationChallenge.builder()
                    .claimToken(urlToken(20))
                    .accountId(UUID.randomUUID().toString())
                    .displayName(name)
                    .description(cleanDescription)
                    .challengeCode(HexFormat.of().withUpperCase().formatHex(randomBytes(4)))
                    .apiKey(newApiKey())
                    .expiresAt(now.getEpochSecond() + ledgerProperties.getRegistration().getChallengeTtlSeconds())
                    .test(isTestIdentity(name, cleanDescription))
                    .build();
            state.getRegistrationChallenges().put(challenge.getClaimToken(), challenge);
            state.getPendingByName().put(name, challenge.getClaimToken());
            state.getRegistrationByApiKey().put(challenge.getApiKey(), challenge.getClaimToken());

            boolean requireClaim = ledgerProperties.getRegistration().isRequireClaim();
            if (!requireClaim) {
                LedgerResult<AccountRegistration> created = completeClaim(challenge, now);
                if (created.isRejected()) {
                    throw new IllegalStateException("Registration for " + name + " failed after name check: "
                            + created.error().code());
                }
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("claim_token", challenge.getClaimToken());
            details.put("require_claim", requireClaim);
            details.put("is_test", challenge.isTest());
            recordEvent(ActivityType.REGISTRATION_ISSUED, challenge.getAccountId(), name, details);
            commit();
            return LedgerResult.ok(challenge.toBuilder().build());
        });
    }

    public LedgerResult<AccountRegistration> claimRegistration(String claimToken) {
        return claimRegistration(claimToken, Instant.now());
    }

    LedgerResult<AccountRegistration> claimRegistration(String claimToken, Instant now) {
        return withLock(() -> {
            RegistrationChallenge challenge = claimToken == null ? null : state.getRegistrationChallenges().get(claimToken);
            if (challenge == null) {
                return LedgerResult.<AccountRegistration>reject(LedgerErrorCode.REGISTRATION_NOT_FOUND);
            }
            if (challenge.isClaimed()) {
                Account account = state.getAccounts().get(challenge.getAccountId());
                if (account == null) {
                    return LedgerResult.<AccountRegistration>reject(LedgerErrorCode.REGISTRATION_NOT_FOUND);
                }
                return LedgerResult.ok(new AccountRegistration(account.getAccountId(), account.getDisplayName(),
                        challenge.getApiKey(), ledgerProperties.getStartingCash()));
            }
            if (challenge.getExpiresAt() < now.getEpochSecond()) {
                return LedgerResult.<AccountRegistration>reject(LedgerErrorCode.REGISTRATION_EXPIRED);
            }
            LedgerResult<AccountRegistration> created = completeClaim(challenge, now);
            if (created.isOk()) {
                commit();
            }
            return created;
        });
    }

    public ActivityEvent recordEvent(ActivityType type, String accountId, Map<String, Object> details) {
        requireLocked();
        String displayName = state.account(accountId).map(Account::getDisplayName).orElse(null);
        return appendEvent(type.value(), accountId, displayName, details);
    }

    public ActivityEvent recordEvent(ActivityType type, String accountId, String displayName, Map<String, Object> details) {
        requireLocked();
        return appendEvent(type.value(), accountId, displayName, details);
    }

    public LedgerResult<String> rename(String identifier, String newName) {
        return rename(identifier, newName, Instant.now());
    }

    LedgerResult<String> rename(String identifier, String newName, Instant now) {
        return withLock(() -> {
            Optional<String> resolved = state.resolveAccountId(identifier);
            if (resolved.isEmpty()) {
                return LedgerResult.<String>reject(LedgerErrorCode.AGENT_NOT_FOUND);
            }
            String accountId = resolved.get();
            Account account = state.getAccounts().get(accountId);
            String name = normalizeName(newName);
            if (!DISPLAY_NAME.matcher(name).matches()) {
                return LedgerResult.<String>reject(LedgerErrorCode.INVALID_DISPLAY_NAME);
            }
            String oldName = account.getDisplayName();
            if (name.equals(oldName)) {
                return LedgerResult.ok(name);
            }
            if (isNameTaken(name, accountId) || isNameReserved(name, accountId, now)) {
                return LedgerResult.<String>reject(LedgerErrorCode.NAME_ALREADY_EXISTS);
            }
            int rewritten = applyRename(account, oldName, name);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("updated_fields", List.of("display_name"));
            details.put("previous_display_name", oldName);
            recordEvent(ActivityType.AGENT_PROFILE_UPDATE, accountId, details);
            commit();
            log.info("Account renamed id={} from={} to={} rewrittenEvents={}", accountId, oldName, name, rewritten);
            return LedgerResult.ok(name);
        });
    }

    public LedgerResult<Void> updateProfile(String identifier, String description, String avatar) {
        return withLock(() -> {
            Optional<Account> account = state.resolveAccountId(identifier).flatMap(state::account);
            if (account.isEmpty()) {
                return LedgerResult.<Void>reject(LedgerErrorCode.AGENT_NOT_FOUND);
            }
            List<String> updated = new ArrayList<>();
            if (description != null && !description.trim().equals(account.get().getDescription())) {
                account.get().setDescription(description.trim());
                updated.add("description");
            }
            if (avatar != null && !avatar.trim().equals(account.get().getAvatar())) {
                account.get().setAvatar(avatar.trim());
                updated.add("avatar");
            }
            if (!updated.isEmpty()) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("updated_fields", updated);
                recordEvent(ActivityType.AGENT_PROFILE_UPDATE, account.get().getAccountId(), details);
                commit();
            }
            return LedgerResult.<Void>ok(null);
        });
    }

    public LedgerResult<Void> markTest(String identifier, boolean test) {
        return withLock(() -> {
            Optional<Account> account = state.resolveAccountId(identifier).flatMap(state::account);
            if (account.isEmpty()) {
                return LedgerResult.<Void>reject(LedgerErrorCode.AGENT_NOT_FOUND);
            }
            account.get().setTest(test);
            if (test) {
                state.getTestAccounts().add(account.get().getAccountId());
            } else {
                state.getTestAccounts().remove(account.get().getAccountId());
            }
            commit();
            return LedgerResult.<Void>ok(null);
        });
    }

    public LedgerResult<Boolean> follow(String followerIdentifier, String targetIdentifier) {
        return withLock(() -> {
            Optional<String> follower = state.resolveAccountId(followerIdentifier);
            Optional<String> target = state.resolveAccountId(targetIdentifier);
            if (follower.isEmpty() || target.isEmpty()) {
                return LedgerResult.<Boolean>reject(LedgerErrorCode.AGENT_NOT_FOUND);
            }
            if (follower.get().equals(target.get())) {
                return LedgerResult.ok(false);
            }
            List<String> targets = state.getFollowing().computeIfAbsent(follower.get(), key -> new ArrayList<>());
            if (targets.contains(target.get())) {
                return LedgerResult.ok(false);
            }
            targets.add(target.get());
            commit();
            return LedgerResult.ok(true);
        });
    }

    public LedgerResult<Boolean> unfollow(String followerIdentifier, String targetIdentifier) {
        return withLock(() -> {
            Optional<String> follower = state.resolveAccountId(followerIdentifier);
            Optional<String> target = state.resolveAccountId(targetIdentifier);
            if (follower.isEmpty() || target.isEmpty()) {
                return LedgerResult.<Boolean>reject(LedgerErrorCode.AGENT_NOT_FOUND);
            }
            List<String> targets = state.getFollowing().get(follower.get());
            if (targets == null || !targets.remove(target.get())) {
                return LedgerResult.ok(false);
            }
            if (targets.isEmpty()) {
                state.getFollowing().remove(follower.get());
            }
            commit();
            return LedgerResult.ok(true);
        });
    }

    public LedgerResult<PurgeSummary> purge(String identifier) {
        return withLock(() -> {
            Optional<String> resolved = state.resolveAccountId(identifier);
            if (resolved.isEmpty()) {
                return LedgerResult.<PurgeSummary>reject(LedgerErrorCode.AGENT_NOT_FOUND);
            }
            PurgeSummary summary = accountPurger.purge(state, resolved.get(), identifier);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("purged_account_id", summary.getAccountId());
            details.put("purged_display_name", summary.getDisplayName());
            details.put("removed_activity_events", summary.getRemovedActivityEvents());
            details.put("removed_api_keys", summary.getRemovedApiKeys());
            recordEvent(ActivityType.ADMIN_AGENT_PURGE, null, ADMIN_ACTOR, details);
            commit();
            ledgerMetrics.recordAccountPurged();
            log.warn("Account purged id={} name={} removedEvents={} removedFollows={}",
                    summary.getAccountId(), summary.getDisplayName(), summary.getRemovedActivityEvents(),
                    summary.getRemovedOutgoingFollows() + summary.getRemovedIncomingFollows());
            return LedgerResult.ok(summary);
        });
    }

    /**
     * Newest-first activity for one account, optionally filtered by type. Returns copies.
     */
    public List<ActivityEvent> recentEvents(String identifier, Set<ActivityType> types, int limit) {
        return withLock(() -> {
            Optional<String> accountId = state.resolveAccountId(identifier);
            if (accountId.isEmpty()) {
                return List.<ActivityEvent>of();
            }
            return collectRecent(event -> accountId.get().equals(event.getAccountId()), types, limit);
        });
    }

    public List<ActivityEvent> recentActivity(Set<ActivityType> types, int limit) {
        return withLock(() -> collectRecent(event -> true, types, limit));
    }

    public Optional<Double> lastPrice(String symbol) {
        return withLock(() -> state.lastPrice(symbol));
    }

    public LedgerResult<Double> updatePrice(String symbol, double price) {
        if (symbol == null || symbol.isBlank() || !(price > 0) || Double.isInfinite(price)) {
            return LedgerResult.reject(LedgerErrorCode.INVALID_ORDER, "price must be positive");
        }
        String key = symbol.trim().toUpperCase(Locale.ROOT);
        return withLock(() -> {
            Double previous = state.getPrices().put(key, price);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("symbol", key);
            details.put("price", price);
            details.put("previous_price", previous);
            recordEvent(ActivityType.PRICE_UPDATE, null, ADMIN_ACTOR, details);
            commit();
            return LedgerResult.ok(price);
        });
    }

    public Stats stats() {
        return withLock(() -> new Stats(state.getAccounts().size(), state.getMarkets().size(),
                state.getActivityLog().size(), state.getPrices().size()));
    }

    static boolean isTestIdentity(String displayName, String description) {
        String name = displayName == null ? "" : displayName.toLowerCase(Locale.ROOT);
        String text = description == null ? "" : description.toLowerCase(Locale.ROOT);
        return TEST_TAG.matcher(name).find() || TEST_TAG.matcher(text).find();
    }

    private LedgerResult<AccountRegistration> openAccount(String accountId, String rawName, String apiKey,
                                                          double startingCash, boolean test, String description,
                                                          String source) {
        String name = normalizeName(rawName);
        if (!DISPLAY_NAME.matcher(name).matches()) {
            return LedgerResult.reject(LedgerErrorCode.INVALID_DISPLAY_NAME);
        }
        if (!(startingCash >= 0) || Double.isInfinite(startingCash)) {
            return LedgerResult.reject(LedgerErrorCode.INVALID_AMOUNT);
        }
        if (isNameTaken(name, null) || state.getAccounts().containsKey(accountId)) {
            return LedgerResult.reject(LedgerErrorCode.NAME_ALREADY_EXISTS);
        }
        Account account = Account.builder()
                .accountId(accountId)
                .displayName(name)
                .cash(startingCash)
                .startingCash(startingCash)
                .test(test)
                .description(description == null ? "" : description)
                .registeredAt(Instant.now().toString())
                .registrationSource(source)
                .build();
        state.getAccounts().put(accountId, account);
        state.getNameIndex().put(name, accountId);
        if (test) {
            state.getTestAccounts().add(accountId);
        }
        state.getAgentKeys().put(accountId, apiKey);
        state.getKeyToAgent().put(apiKey, accountId);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("initial_cash", startingCash);
        details.put("is_test", test);
        details.put("registration_source", source);
        recordEvent(ActivityType.AGENT_REGISTERED, accountId, details);
        log.info("Account registered id={} name={} test={}", accountId, name, test);
        return LedgerResult.ok(new AccountRegistration(accountId, name, apiKey, startingCash));
    }

    private LedgerResult<AccountRegistration> completeClaim(RegistrationChallenge challenge, Instant now) {
        LedgerResult<AccountRegistration> created = openAccount(challenge.getAccountId(), challenge.getDisplayName(),
                challenge.getApiKey(), ledgerProperties.getStartingCash(), challenge.isTest(),
                challenge.getDescription(), "registration");
        if (created.isOk()) {
            challenge.setClaimed(true);
            challenge.setClaimedAt(now.toString());
            state.getPendingByName().remove(challenge.getDisplayName());
        }
        return created;
    }

    private int applyRename(Account account, String oldName, String newName) {
        String accountId = account.getAccountId();
        account.setDisplayName(newName);
        state.getNameIndex().remove(oldName, accountId);
        state.getNameIndex().put(newName, accountId);

        String pendingToken = state.getPendingByName().remove(oldName);
        if (pendingToken != null) {
            state.getPendingByName().put(newName, pendingToken);
        }
        for (RegistrationChallenge challenge : state.getRegistrationChallenges().values()) {
            if (accountId.equals(challenge.getAccountId())) {
                challenge.setDisplayName(newName);
            }
        }

        int rewritten = 0;
        for (ActivityEvent event : state.getActivityLog()) {
            boolean actor = accountId.equals(event.getAccountId())
                    || (event.getAccountId() == null && oldName.equals(event.getDisplayName()));
            if (actor) {
                event.setAccountId(accountId);
                event.setDisplayName(newName);
                rewritten++;
            }
            Map<String, Object> details = event.getDetails();
            if (details != null && accountId.equals(details.get(ActivityEvent.TARGET_ACCOUNT_ID))) {
                details.put(ActivityEvent.TARGET_DISPLAY_NAME, newName);
                if (!actor) {
                    rewritten++;
                }
            }
        }
        return rewritten;
    }

    private boolean isNameTaken(String name, String exceptAccountId) {
        Optional<String> holder = state.resolveAccountId(name);
        if (holder.isPresent() && !holder.get().equals(exceptAccountId)) {
            return true;
        }
        String indexed = state.getNameIndex().get(name);
        return indexed != null && state.getAccounts().containsKey(indexed) && !indexed.equals(exceptAccountId);
    }

    /**
     * True when another account's registration challenge for {@code name} is still open.
     */
    private boolean isNameReserved(String name, String exceptAccountId, Instant now) {
        String token = state.getPendingByName().get(name);
        if (token == null) {
            return false;
        }
        RegistrationChallenge challenge = state.getRegistrationChallenges().get(token);
        return challenge != null
                && !challenge.isClaimed()
                && challenge.getExpiresAt() >= now.getEpochSecond()
                && !challenge.getAccountId().equals(exceptAccountId);
    }

    private ActivityEvent appendEvent(String type, String accountId, String displayName, Map<String, Object> details) {
        ActivityEvent event = ActivityEvent.builder()
                .id(state.allocateActivityId())
                .type(type)
                .accountId(accountId)
                .displayName(displayName)
                .details(details == null ? new LinkedHashMap<>() : new LinkedHashMap<>(details))
                .createdAt(Instant.now().toString())
                .build();
        List<ActivityEvent> activityLog = state.getActivityLog();
        activityLog.add(event);
        int overflow = activityLog.size() - ledgerProperties.getActivityLogCapacity();
        if (overflow > 0) {
            activityLog.subList(0, overflow).clear();
        }
        return event;
    }

    private List<ActivityEvent> collectRecent(java.util.function.Predicate<ActivityEvent> filter,
                                              Set<ActivityType> types, int limit) {
        List<ActivityEvent> result = new ArrayList<>();
        List<ActivityEvent> activityLog = state.getActivityLog();
        for (int i = activityLog.size() - 1; i >= 0 && result.size() < Math.max(0, limit); i--) {
            ActivityEvent event = activityLog.get(i);
            if (!filter.test(event)) {
                continue;
            }
            if (types != null && !types.isEmpty() && types.stream().noneMatch(event::isType)) {
                continue;
            }
            result.add(event.copy());
        }
        return result;
    }

    private void applySeeds() {
        LedgerProperties.Seed seed = ledgerProperties.getSeed();
        seed.getPrices().forEach((symbol, price) -> {
            if (symbol != null && price != null && price > 0) {
                state.getPrices().putIfAbsent(symbol.trim().toUpperCase(Locale.ROOT), price);
            }
        });
        for (LedgerProperties.SeedMarket seedMarket : seed.getMarkets()) {
            if (seedMarket.getMarketId() == null || state.getMarkets().containsKey(seedMarket.getMarketId())) {
                continue;
            }
            Map<String, Double> outcomes = new LinkedHashMap<>();
            seedMarket.getOutcomes().forEach((outcome, odds) -> outcomes.put(outcome.trim().toUpperCase(Locale.ROOT), odds));
            state.getMarkets().put(seedMarket.getMarketId(), PredictionMarket.builder()
                    .marketId(seedMarket.getMarketId())
                    .question(seedMarket.getQuestion())
                    .outcomes(outcomes)
                    .source("seed")
                    .build());
        }
    }

    private void requireLocked() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Ledger lock must be held by the calling thread");
        }
    }

    private static String normalizeName(String name) {
        return name == null ? "" : name.trim();
    }

    private String newApiKey() {
        return "crab_" + urlToken(24);
    }

    private String urlToken(int bytes) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes(bytes));
    }

    private byte[] randomBytes(int count) {
        byte[] bytes = new byte[count];
        secureRandom.nextBytes(bytes);
        return bytes;
    }
}
