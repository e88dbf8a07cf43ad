package ussim.events;

import ussim.agents.Actors;
import ussim.config.EventCatalog;
import ussim.config.PolicyCatalog;
import ussim.config.SimulationConfig;
import ussim.core.SimulationLogger;
import ussim.core.SimulationState;
import ussim.core.TurnContext;
import ussim.core.WorldSnapshot;
import ussim.domain.Consequence;
import ussim.domain.EventDefinition;
import ussim.domain.PoliticalParty;
import ussim.domain.PolicyLevel;
import ussim.domain.PolicyTemplate;
import ussim.domain.Regions;
import ussim.domain.TriggerType;
import ussim.legislation.PolicyPipeline;
import ussim.random.RandomStream;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Fires the events of one turn in a fixed order: chained follow-ups that fell due, triggered
 * conditional and scheduled events, queued manual triggers, then at most the configured
 * number of random events. Economy effects apply at once; opinion effects are queued for
 * the opinion phase of the same turn.
 */
public class EventManager {
  public static final String STREAM_KEY = "events";
  public static final String PRESIDENT_TARGET = "president";
  public static final String OPPOSITION_TARGET = "opposition";

  private final EventCatalog catalog;
  private final PolicyCatalog policies;
  private final double randomChance;
  private final int maxRandomPerTurn;

  public EventManager(EventCatalog catalog, PolicyCatalog policies, SimulationConfig config) {
    this(catalog, policies, config.randomEventChance(), config.maxRandomEventsPerTurn());
  }

  public EventManager(EventCatalog catalog, PolicyCatalog policies, double randomChance, int maxRandomPerTurn) {
    this.catalog = catalog;
    this.policies = policies;
    this.randomChance = randomChance;
    this.maxRandomPerTurn = maxRandomPerTurn;
  }

  public EventCatalog catalog() { return catalog; }

  public List<String> process(SimulationState state, TurnContext turn) {
    EventLedger ledger = state.events();
    WorldSnapshot snapshot = turn.snapshot();
    RandomStream stream = state.streams().open(STREAM_KEY, turn.turn());
    List<String> fired = new ArrayList<>();
    ledger.tickCooldowns();

    for (EventLedger.ScheduledEvent due : ledger.takeDue(turn.turn())) {
      EventDefinition event = catalog.get(due.key());
      if (event == null) {
        turn.reportFault(null, due.key(), "chained event is not in the catalog");
        continue;
      }
      fire(state, turn, event, stream, false, fired);
    }

    for (EventDefinition event : catalog.all()) {
      if (event.trigger() != TriggerType.CONDITIONAL && event.trigger() != TriggerType.SCHEDULED) continue;
      if (!ledger.isAvailable(event.key())) continue;
      if (EventTriggers.isTriggered(event, snapshot)) {
        fire(state, turn, event, stream, false, fired);
      }
    }

    for (EventLedger.ManualTrigger trigger : ledger.drainManual()) {
      if (trigger.adHoc()) {
        EventDefinition event = EventDefinition.manual(trigger.key(), trigger.description(), trigger.effect(),
            trigger.regions());
        fire(state, turn, event, stream, true, fired);
        continue;
      }
      EventDefinition event = catalog.get(trigger.key());
      if (event == null) {
        turn.reportFault(null, trigger.key(), "manual event is not in the catalog");
        continue;
      }
      fire(state, turn, event, stream, false, fired);
    }

    Set<String> firedRandom = new HashSet<>();
    for (int i = 0; i < maxRandomPerTurn; i++) {
      if (!stream.chance(randomChance)) break;
      EventDefinition pick = pickRandom(ledger, firedRandom, stream);
      if (pick == null) break;
      firedRandom.add(pick.key());
      fire(state, turn, pick, stream, false, fired);
    }
    return fired;
  }

  private EventDefinition pickRandom(EventLedger ledger, Set<String> exclude, RandomStream stream) {
    List<EventDefinition> pool = new ArrayList<>();
    double total = 0;
    for (EventDefinition event : catalog.byTrigger(TriggerType.RANDOM)) {
      if (event.weight() <= 0 || exclude.contains(event.key()) || !ledger.isAvailable(event.key())) continue;
      pool.add(event);
      total += event.weight();
    }
    if (pool.isEmpty()) return null;
    double roll = stream.nextDouble() * total;
    for (EventDefinition event : pool) {
      roll -= event.weight();
      if (roll < 0) return event;
    }
    return pool.get(pool.size() - 1);
  }

  private void fire(SimulationState state, TurnContext turn, EventDefinition event, RandomStream stream,
                    boolean adHoc, List<String> fired) {
    List<String> regions = event.regions();
    boolean national = regions.isEmpty() || regions.contains(Regions.NATIONAL);
    if (event.effect().hasEconomyEffect()) {
      if (national) {
        state.nation().applyEconomy(event.effect());
      }
      for (String region : regions) {
        if (Regions.NATIONAL.equals(region)) continue;
        if (!state.states().containsKey(region)) {
          turn.reportFault(null, event.key(), "unknown region " + region);
          continue;
        }
        state.state(region).applyEconomy(event.effect());
      }
    }
    List<String> opinionRegions = new ArrayList<>();
    for (String region : regions.isEmpty() ? state.allRegions() : regions) {
      if (Regions.NATIONAL.equals(region) || state.states().containsKey(region)) opinionRegions.add(region);
    }
    turn.queueOpinion(opinionRegions, event.effect(), event.key());

    for (Consequence consequence : event.consequences()) {
      if (consequence.probability() < 1.0 && !stream.chance(consequence.probability())) continue;
      applyConsequence(state, turn, event, consequence);
    }

    if (!adHoc) {
      if (event.recurring()) {
        state.events().startCooldown(event.key(), event.cooldownTurns());
      } else {
        state.events().retire(event.key());
      }
    }
    state.events().recordFired(event.key());
    turn.reportEvent(event.key());
    fired.add(event.key());
    state.log("Event: " + event.name());
    SimulationLogger.log("[Event] " + String.format("%04d-%02d ", turn.year(), turn.month()) + event.name()
        + " - " + event.description());
  }

  private void applyConsequence(SimulationState state, TurnContext turn, EventDefinition event, Consequence consequence) {
    switch (consequence.type()) {
      case CHAIN_EVENT -> state.events().schedule(consequence.target(),
          turn.turn() + Math.max(1, consequence.delayMonths()));
      case POLICY_PROPOSAL -> {
        String president = state.nation().presidentParty();
        PolicyTemplate template = policies.get(consequence.target());
        if (president == null || template == null || template.level() != PolicyLevel.FEDERAL) {
          turn.reportFault(null, consequence.target(), "event " + event.key() + " names no proposable federal policy");
          return;
        }
        String actorId = Actors.partyActorId(president);
        String reason = PolicyPipeline.checkProposal(state, template, null);
        if (reason != null) {
          turn.reportFault(actorId, consequence.target(), reason);
          return;
        }
        PolicyPipeline.propose(state, template, actorId, president, null, turn.turn());
      }
      case PARTY_APPROVAL -> {
        String president = state.nation().presidentParty();
        for (PoliticalParty party : state.parties().values()) {
          boolean hit = switch (consequence.target()) {
            case PRESIDENT_TARGET -> party.id().equals(president);
            case OPPOSITION_TARGET -> !party.id().equals(president);
            default -> party.id().equals(consequence.target());
          };
          if (hit) party.adjustApproval(consequence.amount());
        }
      }
      default -> throw new IllegalStateException("Unhandled consequence " + consequence.type());
    }
  }
}
