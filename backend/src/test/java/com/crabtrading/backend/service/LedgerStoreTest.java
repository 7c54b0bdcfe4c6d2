package com.crabtrading.backend.service;

import com.crabtrading.backend.config.LedgerProperties;
import com.crabtrading.backend.dto.AccountRegistration;
import com.crabtrading.backend.dto.LedgerResult;
import com.crabtrading.backend.dto.PurgeSummary;
import com.crabtrading.backend.exception.LedgerErrorCode;
import com.crabtrading.backend.model.ActivityEvent;
import com.crabtrading.backend.model.ActivityType;
import com.crabtrading.backend.model.RegistrationChallenge;
import com.crabtrading.backend.service.persistence.LedgerPersistenceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class LedgerStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private LedgerProperties properties;
    private LedgerPersistenceService persistence;
    private LedgerStore store;

    @BeforeEach
    void setUp() {
        properties = new LedgerProperties();
        persistence = LedgerStoreTestSupport.emptyPersistence();
        store = LedgerStoreTestSupport.newStore(properties, persistence);
    }

    @Test
    void createsAccountWithStartingCashAndApiKey() {
        AccountRegistration registration = store.createAccount("crab_one").orElseThrow();

        assertThat(registration.startingCash()).isEqualTo(2000.0);
        assertThat(registration.apiKey()).startsWith("crab_");
        assertThat(store.resolve("crab_one")).contains(registration.accountId());
        assertThat(store.resolve(registration.accountId())).contains(registration.accountId());
        assertThat(store.resolveApiKey(registration.apiKey())).contains(registration.accountId());
        assertThat(store.recentEvents("crab_one", Set.of(ActivityType.AGENT_REGISTERED), 5)).hasSize(1);
        verify(persistence, times(1)).save(any());
    }

    @Test
    void rejectsInvalidAndDuplicateNames() {
        store.createAccount("crab_one").orElseThrow();

        assertThat(store.createAccount("x").error()).isEqualTo(LedgerErrorCode.INVALID_DISPLAY_NAME);
        assertThat(store.createAccount("has space").error()).isEqualTo(LedgerErrorCode.INVALID_DISPLAY_NAME);
        assertThat(store.createAccount("crab_one").error()).isEqualTo(LedgerErrorCode.NAME_ALREADY_EXISTS);
    }

    @Test
    void stateAccessRequiresTheLock() {
        assertThatThrownBy(() -> store.state()).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> store.commit()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void registrationWithoutClaimCreatesAccountImmediately() {
        RegistrationChallenge challenge = store.issueRegistration("fast_crab", "trades fast", NOW).orElseThrow();

        assertThat(challenge.isClaimed()).isTrue();
        assertThat(store.resolve("fast_crab")).contains(challenge.getAccountId());
        assertThat(store.resolveApiKey(challenge.getApiKey())).contains(challenge.getAccountId());
    }

    @Test
    void claimFlowHonoursExpiryAndIsIdempotent() {
        properties.getRegistration().setRequireClaim(true);
        RegistrationChallenge challenge = store.issueRegistration("slow_crab", "", NOW).orElseThrow();
        assertThat(store.resolve("slow_crab")).isEmpty();
        assertThat(store.issueRegistration("slow_crab", "", NOW.plusSeconds(5)).orElseThrow().getClaimToken())
                .isEqualTo(challenge.getClaimToken());

        AccountRegistration claimed = store.claimRegistration(challenge.getClaimToken(), NOW.plusSeconds(60)).orElseThrow();
        AccountRegistration again = store.claimRegistration(challenge.getClaimToken(), NOW.plusSeconds(5000)).orElseThrow();

        assertThat(claimed.accountId()).isEqualTo(challenge.getAccountId());
        assertThat(again.accountId()).isEqualTo(claimed.accountId());
        assertThat(store.claimRegistration("missing", NOW).error()).isEqualTo(LedgerErrorCode.REGISTRATION_NOT_FOUND);
    }

    @Test
    void expiredChallengeCannotBeClaimed() {
        properties.getRegistration().setRequireClaim(true);
        RegistrationChallenge challenge = store.issueRegistration("late_crab", "", NOW).orElseThrow();

        LedgerResult<AccountRegistration> result = store.claimRegistration(challenge.getClaimToken(),
                NOW.plusSeconds(properties.getRegistration().getChallengeTtlSeconds() + 1));

        assertThat(result.error()).isEqualTo(LedgerErrorCode.REGISTRATION_EXPIRED);
        assertThat(store.resolve("late_crab")).isEmpty();
    }

    @Test
    void renameCannotTakeNameHeldByOpenRegistration() {
        properties.getRegistration().setRequireClaim(true);
        store.issueRegistration("reserved_crab", "", NOW).orElseThrow();
        store.createAccount("eager_crab").orElseThrow();

        assertThat(store.rename("eager_crab", "reserved_crab", NOW.plusSeconds(5)).error())
                .isEqualTo(LedgerErrorCode.NAME_ALREADY_EXISTS);
        assertThat(store.resolve("eager_crab")).isPresent();

        Instant afterExpiry = NOW.plusSeconds(properties.getRegistration().getChallengeTtlSeconds() + 1);
        assertThat(store.rename("eager_crab", "reserved_crab", afterExpiry).orElseThrow()).isEqualTo("reserved_crab");
    }

    @Test
    void testIdentitiesAreFlagged() {
        assertThat(LedgerStore.isTestIdentity("qa_bot", "")).isTrue();
        assertThat(LedgerStore.isTestIdentity("crab", "smoke run")).isTrue();
        assertThat(LedgerStore.isTestIdentity("contest_winner", "")).isFalse();
    }

    @Test
    void renameRewritesHistoryAndTargetNames() {
        String renamed = store.createAccount("old_name").orElseThrow().accountId();
        String other = store.createAccount("watcher").orElseThrow().accountId();
        store.runLocked(() -> {
            store.recordEvent(ActivityType.STOCK_ORDER, null, "old_name", Map.of("symbol", "AAPL"));
            store.recordEvent(ActivityType.AGENT_PROFILE_UPDATE, other, Map.of(
                    ActivityEvent.TARGET_ACCOUNT_ID, renamed,
                    ActivityEvent.TARGET_DISPLAY_NAME, "old_name"));
        });

        assertThat(store.rename("old_name", "new_name").orElseThrow()).isEqualTo("new_name");

        assertThat(store.resolve("old_name")).isEmpty();
        assertThat(store.resolve("new_name")).contains(renamed);
        List<ActivityEvent> own = store.recentEvents("new_name", Set.of(ActivityType.STOCK_ORDER), 5);
        assertThat(own).singleElement().satisfies(event -> {
            assertThat(event.getAccountId()).isEqualTo(renamed);
            assertThat(event.getDisplayName()).isEqualTo("new_name");
        });
        List<ActivityEvent> watcher = store.recentEvents("watcher", Set.of(ActivityType.AGENT_PROFILE_UPDATE), 5);
        assertThat(watcher.get(0).getDetails()).containsEntry(ActivityEvent.TARGET_DISPLAY_NAME, "new_name");
        assertThat(store.rename("watcher", "new_name").error()).isEqualTo(LedgerErrorCode.NAME_ALREADY_EXISTS);
    }

    @Test
    void activityLogIsCapped() {
        properties.setActivityLogCapacity(3);
        store.createAccount("capped").orElseThrow();

        for (int i = 0; i < 5; i++) {
            store.updatePrice("AAPL", 100 + i).orElseThrow();
        }

        List<ActivityEvent> recent = store.recentActivity(Set.of(), 10);
        assertThat(recent).hasSize(3);
        assertThat(recent.get(0).getDetails()).containsEntry("price", 104.0);
        assertThat(recent.get(0).getId()).isGreaterThan(recent.get(2).getId());
    }

    @Test
    void followAndUnfollowIgnoreSelfAndDuplicates() {
        store.createAccount("fan_crab").orElseThrow();
        store.createAccount("star_crab").orElseThrow();

        assertThat(store.follow("fan_crab", "star_crab").orElseThrow()).isTrue();
        assertThat(store.follow("fan_crab", "star_crab").orElseThrow()).isFalse();
        assertThat(store.follow("fan_crab", "fan_crab").orElseThrow()).isFalse();
        assertThat(store.follow("fan_crab", "ghost").error()).isEqualTo(LedgerErrorCode.AGENT_NOT_FOUND);
        assertThat(store.unfollow("fan_crab", "star_crab").orElseThrow()).isTrue();
        assertThat(store.unfollow("fan_crab", "star_crab").orElseThrow()).isFalse();
    }

    @Test
    void purgeRemovesEveryTraceAndFreesTheName() {
        AccountRegistration doomed = store.createAccount("doomed").orElseThrow();
        store.createAccount("friend").orElseThrow();
        store.follow("doomed", "friend").orElseThrow();
        store.follow("friend", "doomed").orElseThrow();
        store.runLocked(() -> store.recordEvent(ActivityType.STOCK_ORDER, null, "doomed", Map.of("symbol", "AAPL")));

        PurgeSummary summary = store.purge("doomed").orElseThrow();

        assertThat(summary.getRemovedActivityEvents()).isEqualTo(2);
        assertThat(summary.getRemovedOutgoingFollows()).isEqualTo(1);
        assertThat(summary.getRemovedIncomingFollows()).isEqualTo(1);
        assertThat(store.resolve("doomed")).isEmpty();
        assertThat(store.resolveApiKey(doomed.apiKey())).isEmpty();
        assertThat(store.recentActivity(Set.of(), 100))
                .noneMatch(event -> doomed.accountId().equals(event.getAccountId()))
                .noneMatch(event -> "doomed".equals(event.getDisplayName()));
        store.runLocked(() -> {
            assertThat(store.state().getFollowing()).isEmpty();
            assertThat(store.state().getKeyToAgent()).doesNotContainValue(doomed.accountId());
        });

        AccountRegistration reborn = store.createAccount("doomed").orElseThrow();
        assertThat(reborn.accountId()).isNotEqualTo(doomed.accountId());
        assertThat(store.purge("ghost").error()).isEqualTo(LedgerErrorCode.AGENT_NOT_FOUND);
    }
}
