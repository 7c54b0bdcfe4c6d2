package com.crabtrading.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of the capped activity log. {@code displayName} caches the actor's name at the
 * time of the last rename fix-up; {@code accountId} is authoritative.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ActivityEvent {

    public static final String TARGET_ACCOUNT_ID = "target_account_id";
    public static final String TARGET_DISPLAY_NAME = "target_display_name";

    private long id;
    private String type;
    private String accountId;
    private String displayName;

    @Builder.Default
    private Map<String, Object> details = new LinkedHashMap<>();

    private String createdAt;

    public ActivityEvent copy() {
        return toBuilder().details(details == null ? new LinkedHashMap<>() : new LinkedHashMap<>(details)).build();
    }

    public boolean isType(ActivityType activityType) {
        return activityType.value().equals(type);
    }
}
