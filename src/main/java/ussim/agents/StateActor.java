package ussim.agents;

import ussim.config.PolicyCatalog;
import ussim.core.WorldSnapshot;
import ussim.domain.PolicyLevel;
import ussim.domain.PolicyTemplate;
import ussim.legislation.PolicyPipeline;
import ussim.random.RandomStream;

import java.util.ArrayList;
import java.util.List;

/**
 * A state government, acting for its governor's party: local policy or budget tightening.
 */
public class StateActor extends AbstractActor {
  private final String stateId;

  public StateActor(String stateId, PolicyCatalog catalog, double noise) {
    super(Actors.stateActorId(stateId), catalog, noise);
    this.stateId = stateId;
  }

  public String stateId() { return stateId; }

  @Override
  public Intent decide(WorldSnapshot snapshot, RandomStream stream) {
    WorldSnapshot.StateView st = snapshot.state(stateId);
    if (st == null) {
      return Intent.idle(id, null);
    }
    String sponsor = st.governorParty();
    WorldSnapshot.PartyView governor = snapshot.party(sponsor);
    List<Candidate> candidates = new ArrayList<>();
    candidates.add(new Candidate("idle", 0.0, Intent.idle(id, sponsor)));

    double revenue = Math.max(1.0, st.revenue());
    for (PolicyTemplate template : catalog.byLevel(PolicyLevel.STATE)) {
      if (snapshot.isPending(PolicyLevel.STATE, stateId, template.key())) continue;
      if (template.cost() > st.revenue() * PolicyPipeline.MAX_STATE_COST_SHARE) continue;
      double gain = opinionGain(snapshot, stateId, template.issue(), template.direction(), template.effect());
      double costRatio = Math.max(0.0, template.cost()) / revenue;
      double align = governor == null ? 0.0 : governor.stanceOn(template.issue()) * template.direction();
      double score = W_OPINION * (gain + need(st, template)) - W_COST * costRatio + W_ALIGN * align
          - PROPOSAL_HURDLE;
      candidates.add(new Candidate("propose:" + template.key(), score,
          Intent.propose(id, sponsor, template.key(), stateId, score)));
    }

    if (st.deficit() > 0) {
      double pressure = Math.min(1.0, st.deficit() / revenue * 4.0);
      double score = W_COST * pressure - 0.25;
      candidates.add(new Candidate("budget", score, Intent.adjustBudget(id, sponsor, stateId, score)));
    }
    return choose(candidates, stream);
  }

  private static double need(WorldSnapshot.StateView st, PolicyTemplate template) {
    double need = 0;
    need += Math.max(0, st.unemployment() - 5.5) * Math.max(0, -template.effect().unemployment()) * 2.0;
    need += Math.max(0, st.inflation() - 4.0) * Math.max(0, -template.effect().inflation()) * 2.0;
    if (st.deficit() > 0 && template.cost() < 0) {
      need += Math.min(1.0, st.deficit() / Math.max(1.0, st.revenue()) * 5.0) * 0.5;
    }
    return need;
  }
}
