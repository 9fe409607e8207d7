package com.zzf.clawcontrol.sync;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * Source of raw local change notifications. Delivers paths relative to the notes root
 * (forward slashes), possibly from its own thread and possibly many times per change.
 */
public interface LocalChangeSource extends AutoCloseable {

    void start(Consumer<String> onChange) throws IOException;

    @Override
    void close();
}
