package com.zzf.clawcontrol.connection;

public class NotConnectedException extends IllegalStateException {

    public NotConnectedException(String message) {
        super(message);
    }
}
