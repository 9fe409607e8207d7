package com.zzf.clawcontrol.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * File sync actions. Outbound {@code file_sync} frames only ever carry
 * {@link #UPSERT} or {@link #DELETE}; {@link #RENAME} arrives from the app.
 */
public enum SyncAction {
    UPSERT("upsert"),
    DELETE("delete"),
    RENAME("rename");

    private final String wireName;

    SyncAction(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static SyncAction fromWire(String raw) {
        if (raw != null) {
            String normalized = raw.trim().toLowerCase(Locale.ROOT);
            for (SyncAction action : values()) {
                if (action.wireName.equals(normalized)) {
                    return action;
                }
            }
        }
        throw new IllegalArgumentException("Unknown sync action: " + raw);
    }
}
