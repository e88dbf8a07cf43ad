package ussim.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ussim.core.ConfigurationFault;
import ussim.core.SimulationState;
import ussim.domain.Chamber;
import ussim.domain.District;
import ussim.domain.EffectVector;
import ussim.domain.Election;
import ussim.domain.ElectionKind;
import ussim.domain.ElectionStatus;
import ussim.domain.Nation;
import ussim.domain.PoliticalParty;
import ussim.domain.Policy;
import ussim.domain.PolicyLevel;
import ussim.domain.PolicyStatus;
import ussim.domain.PolicyTemplate;
import ussim.domain.SenateSeat;
import ussim.domain.State;
import ussim.domain.VoteTally;
import ussim.domain.VoterCohort;
import ussim.events.EventLedger;
import ussim.opinion.PublicOpinionTracker;
import ussim.random.RandomStreams;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Persisted snapshot contract. Writes a JSON document with a fixed field order and sorted
 * map keys, so equal worlds serialize to identical text; reads it back with full validation.
 */
public class SnapshotCodec {
  public static final int FORMAT_VERSION = 1;

  private final ObjectMapper mapper = new ObjectMapper()
      .enable(SerializationFeature.INDENT_OUTPUT)
      .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

  public String save(SimulationState state) {
    try {
      return mapper.writeValueAsString(toTree(state));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Snapshot serialization failed", e);
    }
  }

  public SimulationState load(String text) throws SnapshotLoadException {
    if (text == null || text.isBlank()) {
      throw new SnapshotLoadException("Empty snapshot");
    }
    JsonNode root;
    try {
      root = mapper.readTree(text);
    } catch (JsonProcessingException e) {
      throw new SnapshotLoadException("Malformed snapshot JSON: " + e.getOriginalMessage(), e);
    }
    return fromTree(root);
  }

  /** Deep copy through the persisted form; used for turn checkpoints. */
  public SimulationState copy(SimulationState state) {
    try {
      return fromTree(toTree(state));
    } catch (SnapshotLoadException e) {
      throw new IllegalStateException("Checkpoint of a live world failed to reload: " + e.getMessage(), e);
    }
  }

  // ---- writing ----

  public ObjectNode toTree(SimulationState state) {
    ObjectNode root = mapper.createObjectNode();
    root.put("format", FORMAT_VERSION);

    ObjectNode clock = root.putObject("clock");
    clock.put("year", state.year());
    clock.put("month", state.month());
    clock.put("completedTurns", state.completedTurns());

    ObjectNode rng = root.putObject("rng");
    rng.put("seed", state.streams().seed());
    ObjectNode counters = rng.putObject("counters");
    new TreeMap<>(state.streams().counters()).forEach(counters::put);

    Nation nation = state.nation();
    ObjectNode national = root.putObject("national");
    national.put("presidentParty", nation.presidentParty());
    national.put("federalRevenue", nation.federalRevenue());
    national.put("federalSpending", nation.federalSpending());
    national.put("federalTaxRate", nation.federalTaxRate());
    national.put("growth", nation.growth());
    national.put("unemployment", nation.unemployment());
    national.put("inflation", nation.inflation());
    national.put("presidentApproval", nation.presidentApproval());
    national.put("congressApproval", nation.congressApproval());
    national.put("courtLean", nation.courtLean());

    ArrayNode parties = root.putArray("parties");
    for (PoliticalParty party : state.parties().values()) {
      ObjectNode p = parties.addObject();
      p.put("id", party.id());
      p.put("name", party.name());
      putDoubles(p.putObject("platform"), party.platform());
      p.put("treasury", party.treasury());
      p.put("approval", party.nationalApproval());
      ObjectNode seats = p.putObject("seats");
      for (Chamber chamber : Chamber.values()) {
        seats.put(chamber.name(), party.seats(chamber));
      }
    }

    ArrayNode states = root.putArray("states");
    for (State st : state.states().values()) {
      states.add(writeState(st));
    }

    ObjectNode chambers = root.putObject("chambers");
    for (Chamber chamber : Chamber.values()) {
      chambers.put(chamber.name(), state.chamberSize(chamber));
    }

    PublicOpinionTracker tracker = state.opinion();
    ObjectNode opinion = root.putObject("opinion");
    opinion.put("decayRate", tracker.decayRate());
    opinion.put("maxDelta", tracker.maxDelta());
    ObjectNode values = opinion.putObject("values");
    for (var region : tracker.entries().entrySet()) {
      putDoubles(values.putObject(region.getKey()), region.getValue());
    }

    ArrayNode policies = root.putArray("policies");
    for (Policy policy : state.policies()) {
      policies.add(writePolicy(policy));
    }

    ArrayNode elections = root.putArray("elections");
    for (Election election : state.elections()) {
      ObjectNode e = elections.addObject();
      e.put("id", election.id());
      e.put("kind", election.kind().name());
      e.put("year", election.year());
      e.put("month", election.month());
      ArrayNode seats = e.putArray("seats");
      election.contestedSeats().forEach(seats::add);
      e.put("status", election.status().name());
      ObjectNode winners = e.putObject("winners");
      new TreeMap<>(election.winners()).forEach(winners::put);
      ObjectNode totals = e.putObject("seatTotals");
      new TreeMap<>(election.seatTotals()).forEach(totals::put);
    }

    EventLedger ledger = state.events();
    ObjectNode events = root.putObject("events");
    ObjectNode cooldowns = events.putObject("cooldowns");
    new TreeMap<>(ledger.cooldowns()).forEach(cooldowns::put);
    ArrayNode retired = events.putArray("retired");
    ledger.retired().forEach(retired::add);
    ArrayNode chains = events.putArray("chains");
    for (EventLedger.ScheduledEvent scheduled : ledger.scheduled()) {
      ObjectNode c = chains.addObject();
      c.put("key", scheduled.key());
      c.put("fireTurn", scheduled.fireTurn());
    }
    ArrayNode manual = events.putArray("manual");
    for (EventLedger.ManualTrigger trigger : ledger.manualQueue()) {
      ObjectNode m = manual.addObject();
      m.put("key", trigger.key());
      m.put("description", trigger.description());
      if (trigger.adHoc()) {
        m.set("effect", writeEffect(trigger.effect()));
      }
      ArrayNode regions = m.putArray("regions");
      trigger.regions().forEach(regions::add);
    }
    ArrayNode recent = events.putArray("recent");
    ledger.recent().forEach(recent::add);

    root.put("sequence", state.policySequence());
    ArrayNode log = root.putArray("log");
    state.log().entries().forEach(log::add);
    return root;
  }

  private ObjectNode writeState(State st) {
    ObjectNode s = mapper.createObjectNode();
    s.put("id", st.id());
    s.put("name", st.name());
    s.put("population", st.population());
    putDoubles(s.putObject("lean"), st.lean());
    s.put("governorParty", st.governorParty());
    s.put("governorApproval", st.governorApproval());
    s.put("legislatureApproval", st.legislatureApproval());
    s.set("cohorts", writeCohorts(st.cohorts()));
    s.put("legislatureSize", st.legislatureSize());
    ObjectNode legislature = s.putObject("legislature");
    new TreeMap<>(st.legislature()).forEach(legislature::put);
    s.put("revenue", st.revenue());
    s.put("spending", st.spending());
    s.put("taxRate", st.taxRate());
    s.put("gdp", st.gdp());
    s.put("unemployment", st.unemployment());
    s.put("inflation", st.inflation());
    ArrayNode enacted = s.putArray("enactedPolicies");
    st.enactedPolicyIds().forEach(enacted::add);
    putDoubles(s.putObject("campaignSpend"), st.campaignSpend());
    ArrayNode districts = s.putArray("districts");
    for (District district : st.districts()) {
      ObjectNode d = districts.addObject();
      d.put("id", district.id());
      putDoubles(d.putObject("lean"), district.lean());
      d.put("incumbent", district.incumbent());
      d.set("cohorts", writeCohorts(district.cohorts()));
      putDoubles(d.putObject("voterShares"), district.voterShares());
    }
    ArrayNode senate = s.putArray("senateSeats");
    for (SenateSeat seat : st.senateSeats()) {
      ObjectNode ss = senate.addObject();
      ss.put("id", seat.id());
      ss.put("seatClass", seat.seatClass());
      ss.put("incumbent", seat.incumbent());
    }
    return s;
  }

  private ArrayNode writeCohorts(List<VoterCohort> cohorts) {
    ArrayNode array = mapper.createArrayNode();
    for (VoterCohort cohort : cohorts) {
      ObjectNode c = array.addObject();
      c.put("name", cohort.name());
      c.put("share", cohort.share());
      c.put("lean", cohort.lean());
      c.put("turnout", cohort.turnout());
    }
    return array;
  }

  private ObjectNode writePolicy(Policy policy) {
    ObjectNode p = mapper.createObjectNode();
    p.put("id", policy.id());
    PolicyTemplate template = policy.template();
    ObjectNode t = p.putObject("template");
    t.put("key", template.key());
    t.put("title", template.title());
    t.put("level", template.level().name());
    t.put("issue", template.issue());
    t.put("direction", template.direction());
    t.put("cost", template.cost());
    t.set("effect", writeEffect(template.effect()));
    p.put("sponsorActorId", policy.sponsorActorId());
    p.put("sponsorPartyId", policy.sponsorPartyId());
    p.put("stateId", policy.stateId());
    p.put("proposedTurn", policy.proposedTurn());
    p.put("status", policy.status().name());
    p.put("votingTurn", policy.votingTurn());
    p.put("resolvedTurn", policy.resolvedTurn());
    p.put("vetoed", policy.vetoed());
    ArrayNode tallies = p.putArray("tallies");
    for (VoteTally tally : policy.tallies()) {
      ObjectNode v = tallies.addObject();
      v.put("chamber", tally.chamber());
      v.put("yes", tally.yes());
      v.put("no", tally.no());
      v.put("threshold", tally.threshold());
    }
    return p;
  }

  private ObjectNode writeEffect(EffectVector effect) {
    ObjectNode e = mapper.createObjectNode();
    e.put("growth", effect.growth());
    e.put("unemployment", effect.unemployment());
    e.put("inflation", effect.inflation());
    e.put("budget", effect.budget());
    putDoubles(e.putObject("opinion"), effect.opinion());
    return e;
  }

  private static void putDoubles(ObjectNode node, Map<String, Double> values) {
    new TreeMap<>(values).forEach(node::put);
  }

  // ---- reading ----

  public SimulationState fromTree(JsonNode root) throws SnapshotLoadException {
    if (root == null || !root.isObject()) {
      throw new SnapshotLoadException("Snapshot root must be an object");
    }
    int format = reqInt(root, "format", "");
    if (format != FORMAT_VERSION) {
      throw new SnapshotLoadException("Unsupported snapshot format " + format);
    }
    try {
      return read(root);
    } catch (IllegalArgumentException | IllegalStateException | ConfigurationFault e) {
      throw new SnapshotLoadException("Invalid snapshot: " + e.getMessage(), e);
    }
  }

  private SimulationState read(JsonNode root) throws SnapshotLoadException {
    JsonNode clock = reqObject(root, "clock", "");
    JsonNode rng = reqObject(root, "rng", "");
    Map<String, Long> counters = new TreeMap<>();
    JsonNode counterNode = reqObject(rng, "counters", "rng");
    for (Iterator<Map.Entry<String, JsonNode>> it = counterNode.fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> entry = it.next();
      if (!entry.getValue().canConvertToLong()) {
        throw new SnapshotLoadException("Stream counter " + entry.getKey() + " is not an integer");
      }
      counters.put(entry.getKey(), entry.getValue().asLong());
    }
    RandomStreams streams = new RandomStreams(reqLong(rng, "seed", "rng"), counters);

    JsonNode nat = reqObject(root, "national", "");
    Nation nation = new Nation(optText(nat, "presidentParty"), reqDouble(nat, "federalRevenue", "national"),
        reqDouble(nat, "federalSpending", "national"), reqDouble(nat, "federalTaxRate", "national"),
        reqDouble(nat, "growth", "national"), reqDouble(nat, "unemployment", "national"),
        reqDouble(nat, "inflation", "national"));
    nation.setPresidentApproval(reqApproval(nat, "presidentApproval", "national"));
    nation.setCongressApproval(reqApproval(nat, "congressApproval", "national"));
    nation.setCourtLean(optText(nat, "courtLean"));

    JsonNode op = reqObject(root, "opinion", "");
    PublicOpinionTracker opinion = new PublicOpinionTracker(reqDouble(op, "decayRate", "opinion"),
        reqDouble(op, "maxDelta", "opinion"));
    JsonNode values = reqObject(op, "values", "opinion");
    for (Iterator<Map.Entry<String, JsonNode>> it = values.fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> region = it.next();
      for (var issue : readDoubles(region.getValue(), "opinion." + region.getKey()).entrySet()) {
        opinion.set(region.getKey(), issue.getKey(), issue.getValue());
      }
    }

    SimulationState state = new SimulationState(reqInt(clock, "year", "clock"), reqInt(clock, "month", "clock"),
        nation, opinion, streams);

    for (JsonNode p : reqArray(root, "parties", "")) {
      PoliticalParty party = new PoliticalParty(reqText(p, "id", "parties"), reqText(p, "name", "parties"),
          readDoubles(reqObject(p, "platform", "parties"), "platform"), reqDouble(p, "treasury", "parties"),
          reqDouble(p, "approval", "parties"));
      JsonNode seats = reqObject(p, "seats", "parties");
      for (Chamber chamber : Chamber.values()) {
        party.setSeats(chamber, reqInt(seats, chamber.name(), "parties.seats"));
      }
      state.addParty(party);
    }

    for (JsonNode s : reqArray(root, "states", "")) {
      state.addState(readState(s));
    }

    JsonNode chambers = reqObject(root, "chambers", "");
    for (Chamber chamber : Chamber.values()) {
      state.setChamberSize(chamber, reqInt(chambers, chamber.name(), "chambers"));
    }

    for (JsonNode p : reqArray(root, "policies", "")) {
      state.addPolicy(readPolicy(p));
    }

    for (JsonNode e : reqArray(root, "elections", "")) {
      List<String> seats = readStrings(reqArray(e, "seats", "elections"));
      Map<String, String> winners = new TreeMap<>();
      for (Iterator<Map.Entry<String, JsonNode>> it = reqObject(e, "winners", "elections").fields(); it.hasNext(); ) {
        Map.Entry<String, JsonNode> w = it.next();
        winners.put(w.getKey(), w.getValue().asText());
      }
      state.recordElection(Election.restore(reqText(e, "id", "elections"),
          parseEnum(ElectionKind.class, reqText(e, "kind", "elections")),
          reqInt(e, "year", "elections"), reqInt(e, "month", "elections"), seats,
          parseEnum(ElectionStatus.class, reqText(e, "status", "elections")), winners,
          readInts(reqObject(e, "seatTotals", "elections"), "elections.seatTotals")));
    }

    readEvents(reqObject(root, "events", ""), state.events());

    List<String> log = readStrings(reqArray(root, "log", ""));
    SimulationState.restoreCounters(state, reqInt(clock, "completedTurns", "clock"), reqLong(root, "sequence", ""), log);

    verifySeats(state);
    return state;
  }

  private State readState(JsonNode s) throws SnapshotLoadException {
    String id = reqText(s, "id", "states");
    String ctx = "states." + id;
    State st = new State(id, reqText(s, "name", ctx), reqLong(s, "population", ctx),
        readDoubles(reqObject(s, "lean", ctx), ctx + ".lean"), reqText(s, "governorParty", ctx),
        reqInt(s, "legislatureSize", ctx), readInts(reqObject(s, "legislature", ctx), ctx + ".legislature"));
    st.setGovernorApproval(reqApproval(s, "governorApproval", ctx));
    st.setLegislatureApproval(reqApproval(s, "legislatureApproval", ctx));
    st.setCohorts(readCohorts(reqArray(s, "cohorts", ctx), ctx + ".cohorts"));
    st.setRevenue(reqDouble(s, "revenue", ctx));
    st.setSpending(reqDouble(s, "spending", ctx));
    st.setTaxRate(reqDouble(s, "taxRate", ctx));
    st.setGdp(reqDouble(s, "gdp", ctx));
    st.setUnemployment(reqDouble(s, "unemployment", ctx));
    st.setInflation(reqDouble(s, "inflation", ctx));
    for (String policyId : readStrings(reqArray(s, "enactedPolicies", ctx))) {
      st.recordEnactedPolicy(policyId);
    }
    readDoubles(reqObject(s, "campaignSpend", ctx), ctx + ".campaignSpend").forEach(st::addCampaignSpend);
    for (JsonNode d : reqArray(s, "districts", ctx)) {
      District district = new District(reqText(d, "id", ctx + ".districts"), id,
          readDoubles(reqObject(d, "lean", ctx + ".districts"), ctx + ".districts.lean"), optText(d, "incumbent"));
      district.setVoterShares(readDoubles(reqObject(d, "voterShares", ctx + ".districts"), ctx + ".districts.voterShares"));
      district.setCohorts(readCohorts(reqArray(d, "cohorts", ctx + ".districts"), ctx + ".districts.cohorts"));
      st.districts().add(district);
    }
    for (JsonNode ss : reqArray(s, "senateSeats", ctx)) {
      st.senateSeats().add(new SenateSeat(reqText(ss, "id", ctx + ".senateSeats"), id,
          reqInt(ss, "seatClass", ctx + ".senateSeats"), optText(ss, "incumbent")));
    }
    return st;
  }

  private List<VoterCohort> readCohorts(JsonNode array, String ctx) throws SnapshotLoadException {
    List<VoterCohort> cohorts = new ArrayList<>();
    for (JsonNode c : array) {
      cohorts.add(new VoterCohort(reqText(c, "name", ctx), reqDouble(c, "share", ctx), optText(c, "lean"),
          reqDouble(c, "turnout", ctx)));
    }
    return cohorts;
  }

  private Policy readPolicy(JsonNode p) throws SnapshotLoadException {
    String id = reqText(p, "id", "policies");
    String ctx = "policies." + id;
    JsonNode t = reqObject(p, "template", ctx);
    PolicyTemplate template = new PolicyTemplate(reqText(t, "key", ctx), reqText(t, "title", ctx),
        parseEnum(PolicyLevel.class, reqText(t, "level", ctx)), reqText(t, "issue", ctx),
        reqDouble(t, "direction", ctx), reqDouble(t, "cost", ctx), readEffect(reqObject(t, "effect", ctx), ctx));
    List<VoteTally> tallies = new ArrayList<>();
    for (JsonNode v : reqArray(p, "tallies", ctx)) {
      tallies.add(new VoteTally(reqText(v, "chamber", ctx), reqDouble(v, "yes", ctx), reqDouble(v, "no", ctx),
          reqDouble(v, "threshold", ctx)));
    }
    return Policy.restore(id, template, reqText(p, "sponsorActorId", ctx), reqText(p, "sponsorPartyId", ctx),
        optText(p, "stateId"), reqInt(p, "proposedTurn", ctx), parseEnum(PolicyStatus.class, reqText(p, "status", ctx)),
        reqInt(p, "votingTurn", ctx), reqInt(p, "resolvedTurn", ctx), reqBoolean(p, "vetoed", ctx), tallies);
  }

  private EffectVector readEffect(JsonNode e, String ctx) throws SnapshotLoadException {
    return new EffectVector(reqDouble(e, "growth", ctx), reqDouble(e, "unemployment", ctx),
        reqDouble(e, "inflation", ctx), reqDouble(e, "budget", ctx),
        readDoubles(reqObject(e, "opinion", ctx), ctx + ".opinion"));
  }

  private void readEvents(JsonNode events, EventLedger ledger) throws SnapshotLoadException {
    Map<String, Integer> cooldowns = readInts(reqObject(events, "cooldowns", "events"), "events.cooldowns");
    Set<String> retired = new LinkedHashSet<>(readStrings(reqArray(events, "retired", "events")));
    List<EventLedger.ScheduledEvent> chains = new ArrayList<>();
    for (JsonNode c : reqArray(events, "chains", "events")) {
      chains.add(new EventLedger.ScheduledEvent(reqText(c, "key", "events.chains"), reqInt(c, "fireTurn", "events.chains")));
    }
    List<EventLedger.ManualTrigger> manual = new ArrayList<>();
    for (JsonNode m : reqArray(events, "manual", "events")) {
      EffectVector effect = m.hasNonNull("effect") ? readEffect(m.get("effect"), "events.manual") : null;
      manual.add(new EventLedger.ManualTrigger(reqText(m, "key", "events.manual"), optText(m, "description"), effect,
          readStrings(reqArray(m, "regions", "events.manual"))));
    }
    ledger.restore(cooldowns, retired, chains, manual, readStrings(reqArray(events, "recent", "events")));
  }

  /** Seat holders must be known parties, and stored party seat counts must match them and the chamber sizes. */
  private static void verifySeats(SimulationState state) throws SnapshotLoadException {
    for (Chamber chamber : Chamber.values()) {
      Map<String, Integer> counted = new TreeMap<>();
      int seats = 0;
      for (State st : state.states().values()) {
        List<String> holders = new ArrayList<>();
        if (chamber == Chamber.HOUSE) {
          st.districts().forEach(d -> holders.add(d.incumbent()));
        } else {
          st.senateSeats().forEach(s -> holders.add(s.incumbent()));
        }
        for (String holder : holders) {
          seats++;
          if (holder == null) continue;
          if (!state.parties().containsKey(holder)) {
            throw new SnapshotLoadException(chamber + " seat in " + st.id() + " held by unknown party " + holder);
          }
          counted.merge(holder, 1, Integer::sum);
        }
      }
      if (seats != state.chamberSize(chamber)) {
        throw new SnapshotLoadException(chamber + " has " + seats + " seats but size " + state.chamberSize(chamber));
      }
      int stored = 0;
      for (PoliticalParty party : state.parties().values()) {
        int expected = counted.getOrDefault(party.id(), 0);
        if (party.seats(chamber) != expected) {
          throw new SnapshotLoadException(party.id() + " claims " + party.seats(chamber) + " " + chamber
              + " seats but holds " + expected);
        }
        stored += party.seats(chamber);
      }
      if (stored > state.chamberSize(chamber)) {
        throw new SnapshotLoadException(chamber + " seat sum " + stored + " exceeds size " + state.chamberSize(chamber));
      }
    }
    for (State st : state.states().values()) {
      int sum = st.legislature().values().stream().mapToInt(Integer::intValue).sum();
      if (sum != st.legislatureSize()) {
        throw new SnapshotLoadException("Legislature of " + st.id() + " has " + sum + " seats but size " + st.legislatureSize());
      }
    }
  }

  // ---- field helpers ----

  private static JsonNode req(JsonNode node, String field, String ctx) throws SnapshotLoadException {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw new SnapshotLoadException("Missing required field " + (ctx.isEmpty() ? "" : ctx + ".") + field);
    }
    return value;
  }

  private static JsonNode reqObject(JsonNode node, String field, String ctx) throws SnapshotLoadException {
    JsonNode value = req(node, field, ctx);
    if (!value.isObject()) throw new SnapshotLoadException("Field " + ctx + "." + field + " must be an object");
    return value;
  }

  private static JsonNode reqArray(JsonNode node, String field, String ctx) throws SnapshotLoadException {
    JsonNode value = req(node, field, ctx);
    if (!value.isArray()) throw new SnapshotLoadException("Field " + ctx + "." + field + " must be an array");
    return value;
  }

  private static String reqText(JsonNode node, String field, String ctx) throws SnapshotLoadException {
    JsonNode value = req(node, field, ctx);
    if (!value.isTextual()) throw new SnapshotLoadException("Field " + ctx + "." + field + " must be a string");
    return value.asText();
  }

  private static String optText(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }

  private static int reqInt(JsonNode node, String field, String ctx) throws SnapshotLoadException {
    JsonNode value = req(node, field, ctx);
    if (!value.canConvertToInt() || !value.isIntegralNumber()) {
      throw new SnapshotLoadException("Field " + ctx + "." + field + " must be an integer");
    }
    return value.asInt();
  }

  private static long reqLong(JsonNode node, String field, String ctx) throws SnapshotLoadException {
    JsonNode value = req(node, field, ctx);
    if (!value.canConvertToLong() || !value.isIntegralNumber()) {
      throw new SnapshotLoadException("Field " + ctx + "." + field + " must be an integer");
    }
    return value.asLong();
  }

  private static double reqDouble(JsonNode node, String field, String ctx) throws SnapshotLoadException {
    JsonNode value = req(node, field, ctx);
    if (!value.isNumber()) throw new SnapshotLoadException("Field " + ctx + "." + field + " must be a number");
    return value.asDouble();
  }

  private static double reqApproval(JsonNode node, String field, String ctx) throws SnapshotLoadException {
    double value = reqDouble(node, field, ctx);
    if (value < 0.0 || value > 100.0) {
      throw new SnapshotLoadException("Field " + ctx + "." + field + " must be within [0, 100]");
    }
    return value;
  }

  private static boolean reqBoolean(JsonNode node, String field, String ctx) throws SnapshotLoadException {
    JsonNode value = req(node, field, ctx);
    if (!value.isBoolean()) throw new SnapshotLoadException("Field " + ctx + "." + field + " must be a boolean");
    return value.asBoolean();
  }

  private static Map<String, Double> readDoubles(JsonNode node, String ctx) throws SnapshotLoadException {
    Map<String, Double> out = new TreeMap<>();
    for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> entry = it.next();
      if (!entry.getValue().isNumber()) {
        throw new SnapshotLoadException("Value " + ctx + "." + entry.getKey() + " must be a number");
      }
      out.put(entry.getKey(), entry.getValue().asDouble());
    }
    return out;
  }

  private static Map<String, Integer> readInts(JsonNode node, String ctx) throws SnapshotLoadException {
    Map<String, Integer> out = new TreeMap<>();
    for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> entry = it.next();
      if (!entry.getValue().isIntegralNumber()) {
        throw new SnapshotLoadException("Value " + ctx + "." + entry.getKey() + " must be an integer");
      }
      out.put(entry.getKey(), entry.getValue().asInt());
    }
    return out;
  }

  private static List<String> readStrings(JsonNode array) {
    List<String> out = new ArrayList<>();
    for (JsonNode item : array) {
      out.add(item.asText());
    }
    return out;
  }

  private static <E extends Enum<E>> E parseEnum(Class<E> type, String raw) throws SnapshotLoadException {
    try {
      return Enum.valueOf(type, raw);
    } catch (IllegalArgumentException e) {
      throw new SnapshotLoadException("Unknown " + type.getSimpleName() + " value '" + raw + "'", e);
    }
  }
}
