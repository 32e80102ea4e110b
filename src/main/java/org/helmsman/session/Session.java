package org.helmsman.session;

import java.time.Instant;

import org.helmsman.runtime.DecisionEngine;

/**
 * One independent simulation: a scenario and the engine running it.
 * <p>
 * The engine is replaced on {@link SessionManager#reset(String)}; everything else is fixed for the
 * lifetime of the session.
 */
public final class Session {

    private final String id;
    private final String scenario;
    private final Instant createdAt;
    private volatile DecisionEngine engine;

    Session(String id, String scenario, DecisionEngine engine, Instant createdAt) {
        this.id = id;
        this.scenario = scenario;
        this.engine = engine;
        this.createdAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public String getScenario() {
        return scenario;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public DecisionEngine getEngine() {
        return engine;
    }

    void replaceEngine(DecisionEngine engine) {
        this.engine = engine;
    }

    @Override
    public String toString() {
        return "Session[" + id + ", scenario=" + scenario + "]";
    }
}
