package com.crabtrading.backend.service.persistence;

import com.crabtrading.backend.model.Account;
import com.crabtrading.backend.model.ActivityEvent;
import com.crabtrading.backend.model.LedgerState;
import com.crabtrading.backend.model.PositionRecord;
import com.crabtrading.backend.model.PredictionHolding;
import com.crabtrading.backend.model.PredictionMarket;
import com.crabtrading.backend.model.RegistrationChallenge;
import com.crabtrading.backend.service.persistence.migration.SnapshotMigrator;
import com.crabtrading.backend.service.persistence.migration.SnapshotNodes;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps {@link LedgerState} to and from the current-version snapshot document.
 * <p>
 * Decoding is tolerant: missing sections are treated as empty and inconsistencies are
 * repaired. Every repair is reported so the caller can re-save the cleaned snapshot.
 */
@Component
@RequiredArgsConstructor
public class LedgerSnapshotCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> DETAILS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public record DecodeResult(LedgerState state, List<String> repairs) {
        public boolean repaired() {
            return !repairs.isEmpty();
        }
    }

    public ObjectNode encode(LedgerState state) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("version", SnapshotMigrator.CURRENT_VERSION);

        ObjectNode accounts = root.putObject("accounts");
        for (Account account : state.getAccounts().values()) {
            accounts.set(account.getAccountId(), encodeAccount(account));
        }
        root.set("agent_name_to_id", objectMapper.valueToTree(state.getNameIndex()));
        root.set("agent_keys", objectMapper.valueToTree(state.getAgentKeys()));
        root.set("key_to_agent", objectMapper.valueToTree(state.getKeyToAgent()));

        ObjectNode challenges = root.putObject("registration_challenges");
        for (RegistrationChallenge challenge : state.getRegistrationChallenges().values()) {
            ObjectNode node = challenges.putObject(challenge.getClaimToken());
            node.put("account_id", challenge.getAccountId());
            node.put("display_name", challenge.getDisplayName());
            node.put("description", challenge.getDescription());
            node.put("challenge_code", challenge.getChallengeCode());
            node.put("api_key", challenge.getApiKey());
            node.put("expires_at", challenge.getExpiresAt());
            node.put("claimed", challenge.isClaimed());
            node.put("claimed_at", challenge.getClaimedAt());
            node.put("is_test", challenge.isTest());
        }
        root.set("pending_by_agent", objectMapper.valueToTree(state.getPendingByName()));
        root.set("registration_by_api_key", objectMapper.valueToTree(state.getRegistrationByApiKey()));
        root.set("agent_following", objectMapper.valueToTree(state.getFollowing()));

        ArrayNode activity = root.putArray("activity_log");
        for (ActivityEvent event : state.getActivityLog()) {
            ObjectNode node = activity.addObject();
            node.put("id", event.getId());
            node.put("type", event.getType());
            node.put("account_id", event.getAccountId());
            node.put("display_name", event.getDisplayName());
            node.set("details", objectMapper.valueToTree(event.getDetails()));
            node.put("created_at", event.getCreatedAt());
        }
        root.put("next_activity_id", state.getNextActivityId());
        root.set("stock_prices", objectMapper.valueToTree(state.getPrices()));

        ObjectNode markets = root.putObject("poly_markets");
        for (PredictionMarket market : state.getMarkets().values()) {
            ObjectNode node = markets.putObject(market.getMarketId());
            node.put("market_id", market.getMarketId());
            node.put("question", market.getQuestion());
            node.set("outcomes", objectMapper.valueToTree(market.getOutcomes()));
            node.put("resolved", market.isResolved());
            node.put("winning_outcome", market.getWinningOutcome());
            node.put("source", market.getSource());
        }
        root.set("test_agents", objectMapper.valueToTree(state.getTestAccounts()));
        return root;
    }

    public DecodeResult decode(ObjectNode root) {
        LedgerState state = new LedgerState();
        List<String> repairs = new ArrayList<>();

        decodePrices(root.get("stock_prices"), state);
        decodeMarkets(root.get("poly_markets"), state);
        Map<String, String> storedNames = readStringMap(root.get("agent_name_to_id"));
        decodeAccounts(root.get("accounts"), state, repairs);
        rebuildNameIndex(state, storedNames, repairs);

        decodeKeys(root, state, storedNames, repairs);
        decodeRegistrations(root, state);
        decodeFollowing(root.get("agent_following"), state, storedNames, repairs);
        decodeTestAccounts(root.get("test_agents"), state, storedNames);
        decodeActivity(root.get("activity_log"), state, storedNames, repairs);
        decodeNextActivityId(root.get("next_activity_id"), state, repairs);
        return new DecodeResult(state, repairs);
    }

    private ObjectNode encodeAccount(Account account) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("account_id", account.getAccountId());
        node.put("display_name", account.getDisplayName());
        node.put("cash", account.getCash());
        node.put("starting_cash", account.getStartingCash());
        ObjectNode positions = node.putObject("positions");
        ObjectNode avgCost = node.putObject("avg_cost");
        account.getPositions().forEach((symbol, position) -> {
            positions.put(symbol, position.qty());
            avgCost.put(symbol, position.avgCost());
        });
        node.put("realized_pnl", account.getRealizedPnl());
        ObjectNode polyPositions = node.putObject("poly_positions");
        ObjectNode polyCostBasis = node.putObject("poly_cost_basis");
        account.getPolyPositions().forEach((marketId, holdings) -> {
            ObjectNode shares = polyPositions.putObject(marketId);
            ObjectNode basis = polyCostBasis.putObject(marketId);
            holdings.forEach((outcome, holding) -> {
                shares.put(outcome, holding.shares());
                basis.put(outcome, holding.costBasis());
            });
        });
        node.put("poly_realized_pnl", account.getPolyRealizedPnl());
        node.put("blocked", account.isBlocked());
        node.put("is_test", account.isTest());
        node.put("description", account.getDescription());
        node.put("avatar", account.getAvatar());
        node.put("registered_at", account.getRegisteredAt());
        node.put("registration_source", account.getRegistrationSource());
        return node;
    }

    private void decodeAccounts(JsonNode accountsNode, LedgerState state, List<String> repairs) {
        Set<String> usedNames = new HashSet<>();
        for (Map.Entry<String, JsonNode> entry : SnapshotNodes.entries(accountsNode)) {
            JsonNode node = entry.getValue();
            if (!node.isObject()) {
                repairs.add("dropped malformed account entry " + entry.getKey());
                continue;
            }
            String accountId = SnapshotNodes.text(node, "account_id");
            if (accountId.isEmpty()) {
                accountId = entry.getKey();
            }
            if (state.getAccounts().containsKey(accountId)) {
                repairs.add("dropped duplicate account " + accountId);
                continue;
            }
            String base = SnapshotNodes.text(node, "display_name");
            if (base.isEmpty()) {
                base = "agent-" + accountId.substring(0, Math.min(8, accountId.length()));
            }
            String displayName = base;
            int suffix = 2;
            while (usedNames.contains(displayName)) {
                displayName = base + "_" + suffix++;
            }
            if (!displayName.equals(SnapshotNodes.text(node, "display_name"))) {
                repairs.add("display name of " + accountId + " set to " + displayName);
            }
            usedNames.add(displayName);

            Account account = Account.builder()
                    .accountId(accountId)
                    .displayName(displayName)
                    .cash(number(node, "cash", 0.0))
                    .startingCash(number(node, "starting_cash", 0.0))
                    .realizedPnl(number(node, "realized_pnl", 0.0))
                    .polyRealizedPnl(number(node, "poly_realized_pnl", 0.0))
                    .blocked(node.path("blocked").asBoolean(false))
                    .test(node.path("is_test").asBoolean(false))
                    .description(SnapshotNodes.text(node, "description"))
                    .avatar(SnapshotNodes.text(node, "avatar"))
                    .registeredAt(SnapshotNodes.text(node, "registered_at"))
                    .registrationSource(SnapshotNodes.text(node, "registration_source"))
                    .build();

            JsonNode avgCost = node.get("avg_cost");
            for (Map.Entry<String, JsonNode> position : SnapshotNodes.entries(node.get("positions"))) {
                String symbol = position.getKey();
                double qty = position.getValue().asDouble(0.0);
                if (qty == 0.0 || !Double.isFinite(qty)) {
                    repairs.add("dropped empty position " + symbol + " of " + accountId);
                    continue;
                }
                JsonNode avg = avgCost == null ? null : avgCost.get(symbol);
                double cost;
                if (avg != null && avg.isNumber() && Double.isFinite(avg.asDouble())) {
                    cost = avg.asDouble();
                } else {
                    cost = state.lastPrice(symbol).orElse(0.0);
                    repairs.add("average cost of " + symbol + " for " + accountId + " backfilled");
                }
                account.getPositions().put(symbol, new PositionRecord(qty, cost));
            }

            JsonNode costBasis = node.get("poly_cost_basis");
            for (Map.Entry<String, JsonNode> market : SnapshotNodes.entries(node.get("poly_positions"))) {
                JsonNode marketBasis = costBasis == null ? null : costBasis.get(market.getKey());
                for (Map.Entry<String, JsonNode> outcome : SnapshotNodes.entries(market.getValue())) {
                    double shares = outcome.getValue().asDouble(0.0);
                    if (shares == 0.0 || !Double.isFinite(shares)) {
                        continue;
                    }
                    double basis = marketBasis == null ? 0.0 : marketBasis.path(outcome.getKey()).asDouble(0.0);
                    account.getPolyPositions()
                            .computeIfAbsent(market.getKey(), key -> new LinkedHashMap<>())
                            .put(outcome.getKey().toUpperCase(Locale.ROOT), new PredictionHolding(shares, basis));
                }
            }
            state.getAccounts().put(accountId, account);
            if (account.isTest()) {
                state.getTestAccounts().add(accountId);
            }
        }
    }

    private void rebuildNameIndex(LedgerState state, Map<String, String> storedNames, List<String> repairs) {
        for (Account account : state.getAccounts().values()) {
            state.getNameIndex().put(account.getDisplayName(), account.getAccountId());
        }
        if (!storedNames.equals(state.getNameIndex())) {
            repairs.add("name index rebuilt");
        }
    }

    private void decodeKeys(JsonNode root, LedgerState state, Map<String, String> storedNames, List<String> repairs) {
        Map<String, String> agentKeys = readStringMap(root.get("agent_keys"));
        Map<String, String> keyToAgent = readStringMap(root.get("key_to_agent"));
        Map<String, String> reconciled = new LinkedHashMap<>();
        agentKeys.forEach((identity, key) -> resolve(state, storedNames, identity)
                .ifPresent(accountId -> reconciled.putIfAbsent(accountId, key)));
        keyToAgent.forEach((key, identity) -> resolve(state, storedNames, identity)
                .ifPresent(accountId -> reconciled.putIfAbsent(accountId, key)));
        reconciled.forEach((accountId, key) -> {
            if (key.isBlank()) {
                return;
            }
            state.getAgentKeys().put(accountId, key);
            state.getKeyToAgent().put(key, accountId);
        });
        if (!agentKeys.equals(state.getAgentKeys()) || !keyToAgent.equals(state.getKeyToAgent())) {
            repairs.add("api key maps reconciled");
        }
    }

    private void decodeRegistrations(JsonNode root, LedgerState state) {
        for (Map.Entry<String, JsonNode> entry : SnapshotNodes.entries(root.get("registration_challenges"))) {
            JsonNode node = entry.getValue();
            if (!node.isObject()) {
                continue;
            }
            state.getRegistrationChallenges().put(entry.getKey(), RegistrationChallenge.builder()
                    .claimToken(entry.getKey())
                    .accountId(SnapshotNodes.text(node, "account_id"))
                    .displayName(SnapshotNodes.text(node, "display_name"))
                    .description(SnapshotNodes.text(node, "description"))
                    .challengeCode(SnapshotNodes.text(node, "challenge_code"))
                    .apiKey(SnapshotNodes.text(node, "api_key"))
                    .expiresAt(node.path("expires_at").asLong(0L))
                    .claimed(node.path("claimed").asBoolean(false))
                    .claimedAt(SnapshotNodes.text(node, "claimed_at"))
                    .test(node.path("is_test").asBoolean(false))
                    .build());
        }
        state.getPendingByName().putAll(readStringMap(root.get("pending_by_agent")));
        state.getRegistrationByApiKey().putAll(readStringMap(root.get("registration_by_api_key")));
    }

    private void decodeFollowing(JsonNode node, LedgerState state, Map<String, String> storedNames, List<String> repairs) {
        for (Map.Entry<String, JsonNode> entry : SnapshotNodes.entries(node)) {
            Optional<String> follower = resolve(state, storedNames, entry.getKey());
            if (follower.isEmpty()) {
                repairs.add("dropped follows of unknown account " + entry.getKey());
                continue;
            }
            Set<String> targets = new LinkedHashSet<>(state.getFollowing().getOrDefault(follower.get(), List.of()));
            if (entry.getValue().isArray()) {
                for (JsonNode target : entry.getValue()) {
                    String identity = target.isObject() ? firstText(target, "account_id", "agent_uuid", "display_name", "agent_id")
                            : target.asText("");
                    resolve(state, storedNames, identity)
                            .filter(accountId -> !accountId.equals(follower.get()))
                            .ifPresent(targets::add);
                }
            }
            if (!targets.isEmpty()) {
                state.getFollowing().put(follower.get(), new ArrayList<>(targets));
            }
        }
    }

    private void decodeTestAccounts(JsonNode node, LedgerState state, Map<String, String> storedNames) {
        if (node == null || !node.isArray()) {
            return;
        }
        for (JsonNode value : node) {
            resolve(state, storedNames, value.asText("")).ifPresent(accountId -> {
                state.getTestAccounts().add(accountId);
                state.getAccounts().get(accountId).setTest(true);
            });
        }
    }

    private void decodeActivity(JsonNode node, LedgerState state, Map<String, String> storedNames, List<String> repairs) {
        if (node == null || !node.isArray()) {
            return;
        }
        long maxId = 0;
        List<ActivityEvent> withoutId = new ArrayList<>();
        for (JsonNode eventNode : node) {
            if (!eventNode.isObject()) {
                continue;
            }
            JsonNode detailsNode = eventNode.get("details");
            Map<String, Object> details = detailsNode != null && detailsNode.isObject()
                    ? objectMapper.convertValue(detailsNode, DETAILS_TYPE)
                    : new LinkedHashMap<>();
            ActivityEvent event = ActivityEvent.builder()
                    .id(eventNode.path("id").asLong(0L))
                    .type(SnapshotNodes.text(eventNode, "type"))
                    .accountId(emptyToNull(SnapshotNodes.text(eventNode, "account_id")))
                    .displayName(emptyToNull(SnapshotNodes.text(eventNode, "display_name")))
                    .details(details)
                    .createdAt(SnapshotNodes.text(eventNode, "created_at"))
                    .build();
            if (event.getAccountId() == null && event.getDisplayName() != null) {
                Optional<String> resolved = resolve(state, storedNames, event.getDisplayName());
                if (resolved.isPresent()) {
                    event.setAccountId(resolved.get());
                    repairs.add("event actor resolved by name");
                }
            }
            Account actor = event.getAccountId() == null ? null : state.getAccounts().get(event.getAccountId());
            if (actor != null && !actor.getDisplayName().equals(event.getDisplayName())) {
                event.setDisplayName(actor.getDisplayName());
                repairs.add("event display name refreshed");
            }
            if (event.getId() > 0) {
                maxId = Math.max(maxId, event.getId());
            } else {
                withoutId.add(event);
            }
            state.getActivityLog().add(event);
        }
        for (ActivityEvent event : withoutId) {
            event.setId(++maxId);
            repairs.add("event id assigned");
        }
        state.setNextActivityId(maxId + 1);
    }

    private void decodeNextActivityId(JsonNode node, LedgerState state, List<String> repairs) {
        long derived = state.getNextActivityId();
        if (node == null) {
            return;
        }
        long stored = node.asLong(0L);
        if (stored >= derived) {
            state.setNextActivityId(stored);
        } else {
            repairs.add("next activity id derived as " + derived);
        }
    }

    private void decodePrices(JsonNode node, LedgerState state) {
        for (Map.Entry<String, JsonNode> entry : SnapshotNodes.entries(node)) {
            double price = entry.getValue().asDouble(0.0);
            if (price > 0 && Double.isFinite(price)) {
                state.getPrices().put(entry.getKey(), price);
            }
        }
    }

    private void decodeMarkets(JsonNode node, LedgerState state) {
        for (Map.Entry<String, JsonNode> entry : SnapshotNodes.entries(node)) {
            JsonNode marketNode = entry.getValue();
            if (!marketNode.isObject()) {
                continue;
            }
            Map<String, Double> outcomes = new LinkedHashMap<>();
            for (Map.Entry<String, JsonNode> outcome : SnapshotNodes.entries(marketNode.get("outcomes"))) {
                outcomes.put(outcome.getKey().toUpperCase(Locale.ROOT), outcome.getValue().asDouble(0.0));
            }
            String winning = SnapshotNodes.text(marketNode, "winning_outcome");
            state.getMarkets().put(entry.getKey(), PredictionMarket.builder()
                    .marketId(entry.getKey())
                    .question(SnapshotNodes.text(marketNode, "question"))
                    .outcomes(outcomes)
                    .resolved(marketNode.path("resolved").asBoolean(false))
                    .winningOutcome(winning.isEmpty() ? null : winning.toUpperCase(Locale.ROOT))
                    .source(emptyToNull(SnapshotNodes.text(marketNode, "source")))
                    .build());
        }
    }

    private Optional<String> resolve(LedgerState state, Map<String, String> storedNames, String identity) {
        Optional<String> direct = state.resolveAccountId(identity);
        if (direct.isPresent()) {
            return direct;
        }
        String byStoredName = identity == null ? null : storedNames.get(identity.trim());
        return byStoredName != null && state.getAccounts().containsKey(byStoredName)
                ? Optional.of(byStoredName)
                : Optional.empty();
    }

    private Map<String, String> readStringMap(JsonNode node) {
        Map<String, String> values = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> entry : SnapshotNodes.entries(node)) {
            if (entry.getValue().isValueNode() && !entry.getValue().isNull()) {
                values.put(entry.getKey(), entry.getValue().asText());
            }
        }
        return values;
    }

    private String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = SnapshotNodes.text(node, field);
            if (!value.isEmpty()) {
                return value;
            }
        }
        return "";
    }

    private static double number(JsonNode node, String field, double fallback) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber() && !value.isTextual()) {
            return fallback;
        }
        double parsed = value.asDouble(fallback);
        return Double.isFinite(parsed) ? parsed : fallback;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
