package ussim.phases;

import ussim.agents.Intent;
import ussim.config.PolicyCatalog;
import ussim.core.SimulationLogger;
import ussim.core.SimulationState;
import ussim.core.TurnContext;
import ussim.core.TurnPhase;
import ussim.domain.PoliticalParty;
import ussim.domain.PolicyTemplate;
import ussim.domain.State;
import ussim.legislation.PolicyPipeline;

/**
 * Applies the collected intents in actor-id order, then advances the policy pipeline.
 * Intents that no longer hold after the event phase are rejected and reported.
 */
public class LegislativePhase implements TurnPhase {
  /** Share of spending one budget adjustment cuts, capped at the deficit. */
  static final double BUDGET_CUT_SHARE = 0.02;

  private final PolicyCatalog catalog;
  private final PolicyPipeline pipeline;

  public LegislativePhase(PolicyCatalog catalog, PolicyPipeline pipeline) {
    this.catalog = catalog;
    this.pipeline = pipeline;
  }

  @Override
  public String name() { return "Legislature"; }

  @Override
  public void run(SimulationState state, TurnContext turn) {
    for (Intent intent : turn.intents().values()) {
      switch (intent.type()) {
        case PROPOSE -> propose(state, turn, intent);
        case CAMPAIGN -> campaign(state, turn, intent);
        case ADJUST_BUDGET -> adjustBudget(state, turn, intent);
        case IDLE -> { }
        default -> throw new IllegalStateException("Unhandled intent " + intent.type());
      }
    }
    pipeline.process(state, turn);
  }

  private void propose(SimulationState state, TurnContext turn, Intent intent) {
    PolicyTemplate template = catalog.get(intent.templateKey());
    if (template == null) {
      turn.reportFault(intent.actorId(), intent.templateKey(), "unknown policy template");
      return;
    }
    if (intent.partyId() == null || !state.parties().containsKey(intent.partyId())) {
      turn.reportFault(intent.actorId(), intent.templateKey(), "no sponsoring party");
      return;
    }
    String reason = PolicyPipeline.checkProposal(state, template, intent.stateId());
    if (reason != null) {
      turn.reportFault(intent.actorId(), intent.templateKey(), reason);
      return;
    }
    PolicyPipeline.propose(state, template, intent.actorId(), intent.partyId(), intent.stateId(), turn.turn());
  }

  private void campaign(SimulationState state, TurnContext turn, Intent intent) {
    if (!state.parties().containsKey(intent.partyId()) || !state.states().containsKey(intent.stateId())) {
      turn.reportFault(intent.actorId(), intent.stateId(), "campaign target unknown");
      return;
    }
    PoliticalParty party = state.party(intent.partyId());
    if (intent.amount() <= 0 || intent.amount() > party.treasury()) {
      turn.reportFault(intent.actorId(), intent.stateId(),
          String.format("campaign of %.2f unaffordable with treasury %.2f", intent.amount(), party.treasury()));
      return;
    }
    party.setTreasury(party.treasury() - intent.amount());
    state.state(intent.stateId()).addCampaignSpend(party.id(), intent.amount());
    SimulationLogger.log("[Campaign] " + intent.describe());
  }

  private void adjustBudget(SimulationState state, TurnContext turn, Intent intent) {
    if (!state.states().containsKey(intent.stateId())) {
      turn.reportFault(intent.actorId(), intent.stateId(), "unknown state");
      return;
    }
    State st = state.state(intent.stateId());
    if (st.deficit() <= 0) {
      turn.reportFault(intent.actorId(), st.id(), "no deficit left to close");
      return;
    }
    double cut = Math.min(st.deficit(), st.spending() * BUDGET_CUT_SHARE);
    st.setSpending(st.spending() - cut);
    SimulationLogger.log("[Budget] " + intent.describe() + String.format(" by %.2fB", cut));
  }
}
