package org.helmsman.session;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.helmsman.config.ConfigLoader;
import org.helmsman.runtime.DecisionEngine;
import org.helmsman.runtime.EngineSettings;
import org.helmsman.runtime.history.StateSnapshot;
import org.helmsman.runtime.input.InputCommand;
import org.helmsman.runtime.model.RuleSet;
import org.helmsman.scenarios.HarborRuleBook;
import org.helmsman.scenarios.HarborScenarios;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Keeps the active simulation sessions, each with its own engine and state.
 * <p>
 * Sessions share only the immutable rule set and settings, so they can be stepped concurrently
 * from different threads.
 */
public class SessionManager {

    private static final Logger LOG = LoggerFactory.getLogger(SessionManager.class);

    static final String DEFAULT_SCENARIO_PATH = "helmsman.sessions.default-scenario";

    private final RuleSet rules;
    private final EngineSettings settings;
    private final String defaultScenario;
    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    /**
     * @param rules Rules every session runs.
     * @param settings Engine settings every session uses.
     * @param defaultScenario Scenario used by {@link #create()}.
     * @throws IllegalArgumentException if the default scenario is unknown.
     */
    public SessionManager(RuleSet rules, EngineSettings settings, String defaultScenario) {
        if (!HarborScenarios.exists(defaultScenario)) {
            throw new IllegalArgumentException("Unknown default scenario '" + defaultScenario + "'. Available: "
                    + HarborScenarios.names());
        }
        this.rules = rules;
        this.settings = settings;
        this.defaultScenario = defaultScenario;
    }

    /**
     * Creates a manager for the harbour rule book, configured from the {@code helmsman} block.
     *
     * @param config The resolved configuration.
     * @return the manager.
     */
    public static SessionManager fromConfig(Config config) {
        String scenario = config.hasPath(DEFAULT_SCENARIO_PATH)
                ? config.getString(DEFAULT_SCENARIO_PATH)
                : HarborScenarios.DEFAULT;
        return new SessionManager(HarborRuleBook.standard(), ConfigLoader.engineSettings(config), scenario);
    }

    public Session create() {
        return create(defaultScenario);
    }

    /**
     * Starts a session on a fresh copy of the scenario.
     *
     * @param scenario The scenario name.
     * @return the new session.
     * @throws IllegalArgumentException if the scenario is unknown.
     */
    public Session create(String scenario) {
        DecisionEngine engine = newEngine(scenario);
        Session session = new Session(UUID.randomUUID().toString(), scenario, engine, Instant.now());
        sessions.put(session.getId(), session);
        LOG.info("Session {} created with scenario '{}' ({} active)", session.getId(), scenario, sessions.size());
        return session;
    }

    public Optional<Session> get(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * @throws SessionNotFoundException if no such session is active.
     */
    public Session require(String sessionId) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    /**
     * Buffers an input for the session's next tick.
     */
    public void submit(String sessionId, InputCommand command) {
        require(sessionId).getEngine().submit(command);
    }

    /**
     * Runs one tick of the session.
     *
     * @return the committed snapshot.
     */
    public StateSnapshot step(String sessionId) {
        return require(sessionId).getEngine().tick();
    }

    /**
     * Runs several ticks of the session.
     *
     * @return the committed snapshots, in order.
     */
    public List<StateSnapshot> run(String sessionId, int ticks) {
        return require(sessionId).getEngine().run(ticks);
    }

    /**
     * Restarts the session from its scenario's initial state. History is discarded.
     */
    public Session reset(String sessionId) {
        Session session = require(sessionId);
        session.replaceEngine(newEngine(session.getScenario()));
        LOG.info("Session {} reset to scenario '{}'", sessionId, session.getScenario());
        return session;
    }

    /**
     * @return true if the session existed.
     */
    public boolean delete(String sessionId) {
        Session removed = sessions.remove(sessionId);
        if (removed != null) {
            LOG.info("Session {} deleted ({} active)", sessionId, sessions.size());
        }
        return removed != null;
    }

    public int activeCount() {
        return sessions.size();
    }

    public Set<String> scenarios() {
        return HarborScenarios.names();
    }

    public String getDefaultScenario() {
        return defaultScenario;
    }

    private DecisionEngine newEngine(String scenario) {
        return new DecisionEngine(rules, HarborScenarios.create(scenario), settings);
    }
}
