package com.zzf.clawcontrol.session;

/**
 * Where an {@link AgentDispatcher} writes its output for one turn.
 */
public interface ReplySink {

    /**
     * Send a block of reply text; long text is split into several frames.
     */
    void deliver(String text);

    void typing();
}
