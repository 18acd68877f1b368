package com.minicall.calling.store;

import com.minicall.calling.model.CallingState;

import java.util.List;

public record Transition(CallingState state, List<CallingEffect> effects) {

    public Transition {
        effects = effects == null ? List.of() : List.copyOf(effects);
    }

    public static Transition of(CallingState state) {
        return new Transition(state, List.of());
    }

    public static Transition of(CallingState state, CallingEffect effect) {
        return new Transition(state, List.of(effect));
    }
}
