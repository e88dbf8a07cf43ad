package ussim.agents;

import ussim.config.PolicyCatalog;
import ussim.core.WorldSnapshot;
import ussim.domain.PolicyLevel;
import ussim.domain.PolicyTemplate;
import ussim.domain.Regions;
import ussim.random.RandomStream;

import java.util.ArrayList;
import java.util.List;

/**
 * National party strategy: push a federal policy or fund a state campaign.
 */
public class PartyActor extends AbstractActor {
  static final double CAMPAIGN_SHARE = 0.05;
  static final double MIN_CAMPAIGN = 0.5;
  static final double MAX_CAMPAIGN = 20.0;

  private final String partyId;

  public PartyActor(String partyId, PolicyCatalog catalog, double noise) {
    super(Actors.partyActorId(partyId), catalog, noise);
    this.partyId = partyId;
  }

  public String partyId() { return partyId; }

  @Override
  public Intent decide(WorldSnapshot snapshot, RandomStream stream) {
    WorldSnapshot.PartyView party = snapshot.party(partyId);
    if (party == null) {
      return Intent.idle(id, partyId);
    }
    List<Candidate> candidates = new ArrayList<>();
    candidates.add(new Candidate("idle", 0.0, Intent.idle(id, partyId)));

    for (PolicyTemplate template : catalog.byLevel(PolicyLevel.FEDERAL)) {
      if (snapshot.isPending(PolicyLevel.FEDERAL, null, template.key())) continue;
      double gain = opinionGain(snapshot, Regions.NATIONAL, template.issue(), template.direction(), template.effect());
      double economy = economyNeed(snapshot, template);
      double costRatio = Math.max(0.0, template.cost()) / 1000.0;
      double align = party.stanceOn(template.issue()) * template.direction();
      double score = W_OPINION * (gain + economy) - W_COST * costRatio + W_ALIGN * align - PROPOSAL_HURDLE;
      candidates.add(new Candidate("propose:" + template.key(), score,
          Intent.propose(id, partyId, template.key(), null, score)));
    }

    double amount = Math.min(MAX_CAMPAIGN, party.treasury() * CAMPAIGN_SHARE);
    if (amount >= MIN_CAMPAIGN) {
      double urgency = 1.0 / (1.0 + snapshot.monthsUntilElection());
      for (WorldSnapshot.StateView st : snapshot.states().values()) {
        double lean = st.lean().getOrDefault(partyId, 0.0);
        double competitiveness = Math.max(0.0, 1.0 - Math.abs(lean - 0.5) * 2.0);
        double weight = 0.5 + st.population() / 40_000_000.0;
        double fit = platformFit(snapshot, party.platform(), st.id());
        double score = W_OPINION * (competitiveness * urgency * weight + 0.3 * fit)
            - W_COST * (amount / Math.max(1.0, party.treasury()));
        candidates.add(new Candidate("campaign:" + st.id(), score,
            Intent.campaign(id, partyId, st.id(), amount, score)));
      }
    }
    return choose(candidates, stream);
  }

  private static double economyNeed(WorldSnapshot snapshot, PolicyTemplate template) {
    double need = 0;
    if (snapshot.unemployment() > 6.0) need += (snapshot.unemployment() - 6.0) * -template.effect().unemployment();
    if (snapshot.inflation() > 4.0) need += (snapshot.inflation() - 4.0) * -template.effect().inflation();
    if (snapshot.growth() < 0.0) need += template.effect().growth() * 20.0;
    return need;
  }
}
