package com.zzf.clawcontrol.transport;

public final class CloseCodes {

    public static final int NORMAL = 1000;
    public static final int ABNORMAL = 1006;
    /** The app accepted a newer connection for the same account. */
    public static final int SUPERSEDED = 4000;
    /** Reported locally when the upgrade request is answered with 401 or 403. */
    public static final int AUTH_REJECTED = 4401;

    private CloseCodes() {
    }
}
