package ussim.core;

import ussim.agents.AIDecisionEngine;
import ussim.agents.Actor;
import ussim.agents.Actors;
import ussim.config.CatalogLoader;
import ussim.config.EventCatalog;
import ussim.config.PolicyCatalog;
import ussim.config.ScenarioFactory;
import ussim.config.ScenarioValidator;
import ussim.config.SimulationConfig;
import ussim.domain.EffectVector;
import ussim.domain.EventDefinition;
import ussim.domain.Issues;
import ussim.domain.Policy;
import ussim.domain.PolicyLevel;
import ussim.domain.PolicyTemplate;
import ussim.domain.Regions;
import ussim.elections.ElectionScheduler;
import ussim.elections.VoterModel;
import ussim.events.EventLedger;
import ussim.events.EventManager;
import ussim.legislation.PolicyPipeline;
import ussim.persistence.SnapshotCodec;
import ussim.persistence.SnapshotLoadException;
import ussim.phases.DecisionPhase;
import ussim.phases.EconomyPhase;
import ussim.phases.ElectionPhase;
import ussim.phases.EventPhase;
import ussim.phases.LegislativePhase;
import ussim.phases.OpinionPhase;

import java.util.ArrayList;
import java.util.List;

/**
 * Advances the simulation one month at a time through a fixed sequence of phases. Each turn
 * is atomic: it either completes or the world is restored to the end of the previous turn.
 * Manual interventions are accepted only between turns.
 */
public class TurnEngine {
  public static final String MANUAL_EVENT_KEY = "manual";

  private final SimulationConfig config;
  private final SimulationState state;
  private final PolicyCatalog policies;
  private final EventCatalog events;
  private final boolean defaultActors;
  private final SnapshotCodec codec = new SnapshotCodec();
  private final List<TurnListener> listeners = new ArrayList<>();
  private List<TurnPhase> phases;
  private boolean advancing;

  /** Engine whose actors are one party actor per party and one state actor per state. */
  public TurnEngine(SimulationConfig config, SimulationState state, PolicyCatalog policies, EventCatalog events) {
    this(config, state, policies, events, null);
  }

  public TurnEngine(SimulationConfig config, SimulationState state, PolicyCatalog policies, EventCatalog events,
                    List<Actor> actors) {
    this.config = config;
    this.state = state;
    this.policies = policies;
    this.events = events;
    this.defaultActors = actors == null;
    ScenarioValidator.validateCatalogs(state, policies, events);
    this.phases = buildPhases(actors == null
        ? AIDecisionEngine.defaultActors(state, policies, config.aiNoise()) : actors);
  }

  /** Loads the configured catalogs and scenario. */
  public static TurnEngine create(SimulationConfig config) {
    CatalogLoader loader = new CatalogLoader();
    PolicyCatalog policies = loader.loadPolicies(config.policiesPath());
    EventCatalog events = loader.loadEvents(config.eventsPath());
    SimulationState state = new ScenarioFactory().defaultScenario(config);
    SimulationLogger.log("[Setup] " + state.states().size() + " states, " + policies.all().size() + " policies, "
        + events.all().size() + " events, seed " + config.seed());
    return new TurnEngine(config, state, policies, events);
  }

  private List<TurnPhase> buildPhases(List<Actor> actors) {
    List<TurnPhase> list = new ArrayList<>();
    list.add(new EventPhase(new EventManager(events, policies, config)));
    list.add(new DecisionPhase(new AIDecisionEngine(actors)));
    list.add(new LegislativePhase(policies, new PolicyPipeline(config)));
    list.add(new OpinionPhase());
    list.add(new ElectionPhase(new ElectionScheduler(new VoterModel(config))));
    list.add(new EconomyPhase());
    return List.copyOf(list);
  }

  public SimulationState state() { return state; }
  public SimulationConfig config() { return config; }
  public PolicyCatalog policies() { return policies; }
  public EventCatalog events() { return events; }

  public List<String> phaseNames() {
    List<String> names = new ArrayList<>();
    for (TurnPhase phase : phases) names.add(phase.name());
    return names;
  }

  public void addListener(TurnListener listener) {
    listeners.add(listener);
  }

  public void removeListener(TurnListener listener) {
    listeners.remove(listener);
  }

  public boolean isAdvancing() { return advancing; }

  /**
   * Runs exactly {@code months} turns.
   *
   * @throws SimulationFault when a turn fails; that turn is rolled back and the fault carries
   *     the report of the turns that completed
   */
  public TurnReport advance(int months) {
    if (months < 0) throw new IllegalArgumentException("months must be >= 0: " + months);
    if (advancing) throw new IllegalStateException("advance is already running");
    TurnReport.Builder report = new TurnReport.Builder(state.year(), state.month());
    advancing = true;
    try {
      for (int i = 0; i < months; i++) {
        step(report);
      }
    } finally {
      advancing = false;
    }
    return report.build(state.year(), state.month());
  }

  private void step(TurnReport.Builder report) {
    SimulationState checkpoint = codec.copy(state);
    int turn = state.currentTurn();
    TurnContext context = new TurnContext(turn, state.year(), state.month(), WorldSnapshot.capture(state, turn));
    try {
      for (TurnPhase phase : phases) {
        phase.run(state, context);
        for (TurnListener listener : listeners) {
          listener.phaseCompleted(phase.name(), context);
        }
      }
      state.advanceClock();
      for (TurnListener listener : listeners) {
        listener.turnCompleted(context);
      }
    } catch (RuntimeException e) {
      state.replaceWith(checkpoint);
      SimulationFault fault = e instanceof SimulationFault sf ? sf
          : new SimulationFault(turn, null, null, "Turn failed: " + e.getMessage(), e);
      fault.attachCompletedReport(report.build(state.year(), state.month()));
      SimulationLogger.log("[Fault] " + fault.getMessage() + "; rolled back to "
          + String.format("%04d-%02d", state.year(), state.month()));
      throw fault;
    }
    report.merge(context);
  }

  /** Proposes a catalog policy on behalf of an actor; it opens for voting on the next turn. */
  public Policy proposePolicy(String actorId, String templateKey) throws InvalidInterventionException {
    requireBetweenTurns(actorId, templateKey);
    PolicyTemplate template = policies.get(templateKey);
    if (template == null) {
      throw new InvalidInterventionException(actorId, templateKey, "Unknown policy template");
    }
    return proposePolicy(actorId, template);
  }

  /**
   * Proposes a policy drafted outside the catalog. Party actors propose federal policies,
   * state actors policies for their own state.
   */
  public Policy proposePolicy(String actorId, PolicyTemplate template) throws InvalidInterventionException {
    requireBetweenTurns(actorId, template == null ? null : template.key());
    if (template == null) {
      throw new InvalidInterventionException(actorId, null, "No policy given");
    }
    String partyId;
    try {
      partyId = Actors.sponsorParty(state, actorId);
    } catch (IllegalArgumentException e) {
      throw new InvalidInterventionException(actorId, template.key(), "Unknown actor");
    }
    if (partyId == null || !state.parties().containsKey(partyId)) {
      throw new InvalidInterventionException(actorId, template.key(), "Actor has no sponsoring party");
    }
    if (!Issues.ALL.contains(template.issue())) {
      throw new InvalidInterventionException(actorId, template.key(), "Unknown issue " + template.issue());
    }
    if (!Double.isFinite(template.direction()) || !Double.isFinite(template.cost())
        || !template.effect().isFinite()) {
      throw new InvalidInterventionException(actorId, template.key(), "Policy values must be finite numbers");
    }
    String stateId = Actors.stateOf(actorId);
    PolicyLevel expected = stateId == null ? PolicyLevel.FEDERAL : PolicyLevel.STATE;
    if (template.level() != expected) {
      throw new InvalidInterventionException(actorId, template.key(),
          "Actor cannot sponsor a " + template.level() + " policy");
    }
    String reason = PolicyPipeline.checkProposal(state, template, stateId);
    if (reason != null) {
      throw new InvalidInterventionException(actorId, template.key(), reason);
    }
    return PolicyPipeline.propose(state, template, actorId, partyId, stateId, state.completedTurns());
  }

  /** Queues a catalog event; it fires in the event phase of the next turn regardless of its trigger. */
  public void triggerEvent(String eventKey) throws InvalidInterventionException {
    requireBetweenTurns(null, eventKey);
    EventDefinition event = events.get(eventKey);
    if (event == null) {
      throw new InvalidInterventionException(null, eventKey, "Unknown event");
    }
    state.events().enqueueManual(new EventLedger.ManualTrigger(event.key(), event.description(), null, List.of()));
    state.log("Manual trigger queued: " + event.name());
  }

  /**
   * Queues an ad-hoc effect for the next turn. A null or blank region applies it nationwide
   * and to every state.
   */
  public void triggerEvent(EffectVector effect, String region, String description) throws InvalidInterventionException {
    requireBetweenTurns(null, region);
    if (effect == null) {
      throw new InvalidInterventionException(null, region, "No effect given");
    }
    if (!effect.isFinite()) {
      throw new InvalidInterventionException(null, region, "Effect deltas must be finite numbers");
    }
    List<String> regions = List.of();
    if (region != null && !region.isBlank()) {
      if (!Regions.NATIONAL.equals(region) && !state.states().containsKey(region)) {
        throw new InvalidInterventionException(null, region, "Unknown region");
      }
      regions = List.of(region);
    }
    for (String issue : effect.opinion().keySet()) {
      if (!Issues.ALL.contains(issue)) {
        throw new InvalidInterventionException(null, issue, "Unknown issue");
      }
    }
    String text = description == null || description.isBlank() ? "Manual intervention" : description;
    state.events().enqueueManual(new EventLedger.ManualTrigger(MANUAL_EVENT_KEY, text, effect, regions));
    state.log("Manual trigger queued: " + text);
  }

  public String saveSnapshot() {
    return codec.save(state);
  }

  /**
   * Replaces the whole world with the snapshot's. On any error the current world is untouched.
   */
  public void loadSnapshot(String snapshot) throws SnapshotLoadException {
    if (advancing) {
      throw new SnapshotLoadException("Cannot load a snapshot while a turn is running");
    }
    SimulationState loaded = codec.load(snapshot);
    try {
      ScenarioValidator.validate(loaded);
    } catch (ConfigurationFault e) {
      throw new SnapshotLoadException("Snapshot breaks a world invariant: " + e.getMessage(), e);
    }
    try {
      ScenarioValidator.validateCatalogs(loaded, policies, events);
    } catch (ConfigurationFault e) {
      throw new SnapshotLoadException("Snapshot does not fit the loaded catalogs: " + e.getMessage(), e);
    }
    state.replaceWith(loaded);
    if (defaultActors) {
      phases = buildPhases(AIDecisionEngine.defaultActors(state, policies, config.aiNoise()));
    }
    SimulationLogger.log("[Snapshot] Loaded " + String.format("%04d-%02d", state.year(), state.month())
        + " after " + state.completedTurns() + " turns");
  }

  private void requireBetweenTurns(String actorId, String entityId) throws InvalidInterventionException {
    if (advancing) {
      throw new InvalidInterventionException(actorId, entityId, "Interventions are only accepted between turns");
    }
  }
}
