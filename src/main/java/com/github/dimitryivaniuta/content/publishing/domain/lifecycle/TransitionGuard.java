package com.github.dimitryivaniuta.content.publishing.domain.lifecycle;

import java.util.Optional;

/**
 * Extra precondition of a transition, evaluated after the state/event match.
 */
@FunctionalInterface
public interface TransitionGuard {

    /**
     * Checks the guard.
     *
     * @param state current state
     * @return rejection reason, or empty when the transition may proceed
     */
    Optional<String> check(PostState state);
}
