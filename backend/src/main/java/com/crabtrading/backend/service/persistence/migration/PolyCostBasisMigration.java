package com.crabtrading.backend.service.persistence.migration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * v6 to v7: prediction holdings carry a cost basis. Holdings written before it was tracked
 * get a basis of zero.
 */
@Component
public class PolyCostBasisMigration implements SnapshotMigration {

    @Override
    public boolean appliesTo(int version) {
        return version == 6;
    }

    @Override
    public int targetVersion() {
        return 7;
    }

    @Override
    public ObjectNode migrate(ObjectNode snapshot) {
        for (Map.Entry<String, JsonNode> entry : SnapshotNodes.entries(snapshot.get("accounts"))) {
            if (!entry.getValue().isObject()) {
                continue;
            }
            ObjectNode account = (ObjectNode) entry.getValue();
            JsonNode existing = account.get("poly_cost_basis");
            ObjectNode costBasis = existing != null && existing.isObject() ? (ObjectNode) existing : account.objectNode();
            for (Map.Entry<String, JsonNode> market : SnapshotNodes.entries(account.get("poly_positions"))) {
                JsonNode marketBasis = costBasis.get(market.getKey());
                ObjectNode byOutcome = marketBasis != null && marketBasis.isObject()
                        ? (ObjectNode) marketBasis
                        : costBasis.putObject(market.getKey());
                for (Map.Entry<String, JsonNode> outcome : SnapshotNodes.entries(market.getValue())) {
                    if (!byOutcome.has(outcome.getKey())) {
                        byOutcome.put(outcome.getKey(), 0.0);
                    }
                }
            }
            account.set("poly_cost_basis", costBasis);
        }
        return snapshot;
    }
}
