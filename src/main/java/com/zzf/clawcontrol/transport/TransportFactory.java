package com.zzf.clawcontrol.transport;

import java.net.URI;

@FunctionalInterface
public interface TransportFactory {

    Transport open(URI endpoint, TransportListener listener);
}
