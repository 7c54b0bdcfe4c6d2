package com.crabtrading.backend.service.persistence.migration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * v5 to v6: identity fields take their current names. {@code agent_uuid} becomes
 * {@code account_id}; the cached actor name {@code agent_id} on events and challenges becomes
 * {@code display_name}.
 */
@Component
public class FieldNamingMigration implements SnapshotMigration {

    @Override
    public boolean appliesTo(int version) {
        return version == 5;
    }

    @Override
    public int targetVersion() {
        return 6;
    }

    @Override
    public ObjectNode migrate(ObjectNode snapshot) {
        SnapshotNodes.renameField(snapshot, "agent_name_to_uuid", "agent_name_to_id");

        for (Map.Entry<String, JsonNode> entry : SnapshotNodes.entries(snapshot.get("accounts"))) {
            if (entry.getValue().isObject()) {
                ObjectNode account = (ObjectNode) entry.getValue();
                SnapshotNodes.renameField(account, "agent_uuid", "account_id");
                if (!account.has("display_name")) {
                    SnapshotNodes.renameField(account, "agent_id", "display_name");
                }
                account.remove("agent_id");
            }
        }

        for (Map.Entry<String, JsonNode> entry : SnapshotNodes.entries(snapshot.get("registration_challenges"))) {
            if (entry.getValue().isObject()) {
                ObjectNode challenge = (ObjectNode) entry.getValue();
                SnapshotNodes.renameField(challenge, "agent_uuid", "account_id");
                SnapshotNodes.renameField(challenge, "agent_id", "display_name");
            }
        }

        JsonNode activity = snapshot.get("activity_log");
        if (activity != null && activity.isArray()) {
            for (JsonNode node : activity) {
                if (!node.isObject()) {
                    continue;
                }
                ObjectNode event = (ObjectNode) node;
                SnapshotNodes.renameField(event, "agent_uuid", "account_id");
                SnapshotNodes.renameField(event, "agent_id", "display_name");
                JsonNode details = event.get("details");
                if (details != null && details.isObject()) {
                    SnapshotNodes.renameField((ObjectNode) details, "target_agent_uuid", "target_account_id");
                    SnapshotNodes.renameField((ObjectNode) details, "target_agent_id", "target_display_name");
                }
            }
        }
        return snapshot;
    }
}
