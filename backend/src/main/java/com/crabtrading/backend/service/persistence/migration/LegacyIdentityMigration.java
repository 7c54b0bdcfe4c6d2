package com.crabtrading.backend.service.persistence.migration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Pre-v5 state keyed accounts, keys, follows and events by display name. Every account gets a
 * stable UUID (derived from its legacy key so the step stays deterministic) and all name
 * references are rewritten to it.
 */
@Component
public class LegacyIdentityMigration implements SnapshotMigration {

    @Override
    public boolean appliesTo(int version) {
        return version < 5;
    }

    @Override
    public int targetVersion() {
        return 5;
    }

    @Override
    public ObjectNode migrate(ObjectNode snapshot) {
        ObjectNode accounts = snapshot.objectNode();
        Map<String, String> aliases = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> entry : SnapshotNodes.entries(snapshot.get("accounts"))) {
            if (!entry.getValue().isObject()) {
                continue;
            }
            ObjectNode account = ((ObjectNode) entry.getValue()).deepCopy();
            String key = entry.getKey();
            String name = SnapshotNodes.text(account, "display_name");
            if (name.isEmpty()) {
                name = SnapshotNodes.text(account, "agent_id");
            }
            if (name.isEmpty() && !SnapshotNodes.isUuid(key)) {
                name = key;
            }
            String uuid = SnapshotNodes.text(account, "agent_uuid");
            if (!SnapshotNodes.isUuid(uuid)) {
                uuid = SnapshotNodes.isUuid(key) ? key : legacyUuid(key);
            }
            account.put("agent_uuid", uuid);
            account.put("display_name", name);
            account.remove("agent_id");
            accounts.set(uuid, account);
            aliases.putIfAbsent(key, uuid);
            if (!name.isEmpty()) {
                aliases.putIfAbsent(name, uuid);
            }
        }
        snapshot.set("accounts", accounts);

        for (Map.Entry<String, JsonNode> entry : SnapshotNodes.entries(snapshot.get("agent_name_to_uuid"))) {
            String target = entry.getValue().asText("");
            if (accounts.has(target)) {
                aliases.putIfAbsent(entry.getKey(), target);
            }
        }
        ObjectNode nameIndex = snapshot.objectNode();
        for (Map.Entry<String, JsonNode> entry : SnapshotNodes.entries(accounts)) {
            String name = SnapshotNodes.text(entry.getValue(), "display_name");
            if (!name.isEmpty() && !nameIndex.has(name)) {
                nameIndex.put(name, entry.getKey());
            }
        }
        snapshot.set("agent_name_to_uuid", nameIndex);

        ObjectNode agentKeys = snapshot.objectNode();
        for (Map.Entry<String, JsonNode> entry : SnapshotNodes.entries(snapshot.get("agent_keys"))) {
            agentKeys.set(resolve(aliases, accounts, entry.getKey()), entry.getValue());
        }
        snapshot.set("agent_keys", agentKeys);

        ObjectNode keyToAgent = snapshot.objectNode();
        for (Map.Entry<String, JsonNode> entry : SnapshotNodes.entries(snapshot.get("key_to_agent"))) {
            keyToAgent.put(entry.getKey(), resolve(aliases, accounts, entry.getValue().asText("")));
        }
        snapshot.set("key_to_agent", keyToAgent);

        ObjectNode following = snapshot.objectNode();
        for (Map.Entry<String, JsonNode> entry : SnapshotNodes.entries(snapshot.get("agent_following"))) {
            ArrayNode targets = following.arrayNode();
            if (entry.getValue().isArray()) {
                for (JsonNode target : entry.getValue()) {
                    if (target.isTextual()) {
                        targets.add(resolve(aliases, accounts, target.asText()));
                    } else {
                        targets.add(target);
                    }
                }
            }
            following.set(resolve(aliases, accounts, entry.getKey()), targets);
        }
        snapshot.set("agent_following", following);

        JsonNode testAgents = snapshot.get("test_agents");
        if (testAgents != null && testAgents.isArray()) {
            ArrayNode resolved = snapshot.arrayNode();
            for (JsonNode value : testAgents) {
                resolved.add(resolve(aliases, accounts, value.asText("")));
            }
            snapshot.set("test_agents", resolved);
        }

        JsonNode activity = snapshot.get("activity_log");
        if (activity != null && activity.isArray()) {
            for (JsonNode event : activity) {
                if (!event.isObject() || SnapshotNodes.isUuid(SnapshotNodes.text(event, "agent_uuid"))) {
                    continue;
                }
                String actor = SnapshotNodes.text(event, "agent_id");
                String uuid = aliases.get(actor);
                if (uuid != null) {
                    ((ObjectNode) event).put("agent_uuid", uuid);
                }
            }
        }
        return snapshot;
    }

    static String legacyUuid(String legacyKey) {
        return UUID.nameUUIDFromBytes(("crab-legacy-account:" + legacyKey).getBytes(StandardCharsets.UTF_8)).toString();
    }

    private String resolve(Map<String, String> aliases, ObjectNode accounts, String value) {
        if (accounts.has(value)) {
            return value;
        }
        return aliases.getOrDefault(value, value);
    }
}
