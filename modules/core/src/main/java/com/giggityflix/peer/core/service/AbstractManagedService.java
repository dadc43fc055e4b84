package com.giggityflix.peer.core.service;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

/**
 * Base class for {@link ManagedService} implementations: a thread-safe state
 * machine that fires a CDI event on every transition.
 * <p>
 * Subclasses implement {@link #doStart()} and {@link #doStop()}. Both
 * {@link #start()} and {@link #stop()} are idempotent; an exception from
 * either moves the service to {@link State#FAILED} and is rethrown.
 */
public abstract class AbstractManagedService implements ManagedService {

    private final AtomicReference<State> state = new AtomicReference<>(State.STOPPED);

    @Inject
    Event<ServiceStateChangedEvent> stateEvent;

    protected final Logger log = Logger.getLogger(getClass());

    // -- template methods for subclasses --

    protected abstract void doStart() throws Exception;

    protected abstract void doStop() throws Exception;

    // -- ManagedService contract --

    @Override
    public State state() {
        return state.get();
    }

    @Override
    public void start() throws Exception {
        if (state.get() == State.RUNNING) {
            return; // idempotent
        }

        transition(State.STARTING);
        try {
            doStart();
            transition(State.RUNNING);
        } catch (Exception e) {
            fail(e);
            throw e;
        }
    }

    @Override
    public void stop() throws Exception {
        State current = state.get();
        if (current == State.STOPPED || current == State.STOPPING) {
            return; // idempotent
        }

        transition(State.STOPPING);
        try {
            doStop();
            transition(State.STOPPED);
        } catch (Exception e) {
            fail(e);
            throw e;
        }
    }

    @Override
    public void fail(Throwable cause) {
        State old = state.get();
        if (old == State.FAILED) {
            return; // already failed
        }
        log.errorf("Service '%s' failed (was %s): %s", serviceId(), old, cause.getMessage());
        transition(State.FAILED);
    }

    // -- internals --

    private void transition(State newState) {
        State old = state.getAndSet(newState);
        log.infof("Service '%s': %s -> %s", serviceId(), old, newState);
        if (stateEvent != null) {
            stateEvent.fire(new ServiceStateChangedEvent(
                    serviceId(), old, newState, Instant.now()));
        }
    }
}
