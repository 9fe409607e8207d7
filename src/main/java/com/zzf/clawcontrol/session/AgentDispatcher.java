package com.zzf.clawcontrol.session;

import java.util.concurrent.CompletableFuture;

/**
 * Hands a user turn to the agent runtime. Replies stream back through the {@link ReplySink};
 * the returned future completes when the agent is done with the turn.
 *
 * <p>Register one as a Spring bean. Without one, every message is answered with an error.</p>
 */
public interface AgentDispatcher {

    CompletableFuture<Void> dispatch(InboundTurn turn, ReplySink replies);
}
