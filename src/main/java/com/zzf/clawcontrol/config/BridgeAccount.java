package com.zzf.clawcontrol.config;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * One resolved account: where the app listens, the shared secret, and the notes tree to sync.
 */
@Getter
@Builder
@ToString(exclude = "token")
public class BridgeAccount {
    private final String accountId;
    private final String name;
    private final boolean enabled;
    private final String url;
    private final String token;
    private final String notesPath;

    public boolean isConfigured() {
        return url != null && !url.isBlank() && token != null && !token.isBlank();
    }

    public boolean hasNotesPath() {
        return notesPath != null && !notesPath.isBlank();
    }
}
