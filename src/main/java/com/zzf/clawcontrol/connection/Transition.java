package com.zzf.clawcontrol.connection;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@ToString
@EqualsAndHashCode
public final class Transition {
    private final ConnectionState next;
    private final List<Effect> effects;

    private Transition(ConnectionState next, List<Effect> effects) {
        this.next = next;
        this.effects = effects;
    }

    public static Transition to(ConnectionState next, Effect... effects) {
        return new Transition(next, List.of(effects));
    }
}
