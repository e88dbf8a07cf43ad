package ussim.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import ussim.core.ConfigurationFault;
import ussim.domain.Consequence;
import ussim.domain.ConsequenceType;
import ussim.domain.EffectVector;
import ussim.domain.EventCondition;
import ussim.domain.EventDefinition;
import ussim.domain.PolicyLevel;
import ussim.domain.PolicyTemplate;
import ussim.domain.TriggerType;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads the policy and event catalogs. A location is either {@code classpath:<resource>} or a
 * file path. Malformed or inconsistent entries raise {@link ConfigurationFault}.
 */
public class CatalogLoader {
  public static final String CLASSPATH_PREFIX = "classpath:";

  private final ObjectMapper mapper = new ObjectMapper();

  public PolicyCatalog loadPolicies(String location) {
    PolicyConfig[] configs = read(location, PolicyConfig[].class);
    if (configs == null) configs = new PolicyConfig[0];
    List<PolicyTemplate> templates = new ArrayList<>();
    for (PolicyConfig pc : configs) {
      if (pc == null) continue;
      try {
        templates.add(new PolicyTemplate(pc.key, pc.title, parseEnum(PolicyLevel.class, pc.level, pc.key),
            pc.issue, pc.direction, pc.cost, toEffect(pc.effect)));
      } catch (IllegalArgumentException e) {
        throw new ConfigurationFault(pc.key, "Invalid policy template: " + e.getMessage(), e);
      }
    }
    try {
      return new PolicyCatalog(templates);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationFault(location, e.getMessage(), e);
    }
  }

  public EventCatalog loadEvents(String location) {
    EventConfig[] configs = read(location, EventConfig[].class);
    if (configs == null) configs = new EventConfig[0];
    List<EventDefinition> events = new ArrayList<>();
    for (EventConfig ec : configs) {
      if (ec == null) continue;
      try {
        EventCondition condition = ec.condition == null ? null
            : new EventCondition(ec.condition.metric, ec.condition.region, ec.condition.above, ec.condition.threshold);
        List<Consequence> consequences = new ArrayList<>();
        if (ec.consequences != null) {
          for (ConsequenceConfig cc : ec.consequences) {
            consequences.add(new Consequence(parseEnum(ConsequenceType.class, cc.type, ec.key), cc.target,
                cc.delayMonths, cc.probability == null ? 1.0 : cc.probability, cc.amount));
          }
        }
        events.add(new EventDefinition(ec.key, ec.name, ec.description, ec.weight == null ? 1.0 : ec.weight,
            parseEnum(TriggerType.class, ec.trigger, ec.key), condition, ec.month, ec.yearModulo,
            toEffect(ec.effect), ec.regions, ec.recurring, ec.cooldownTurns, consequences));
      } catch (IllegalArgumentException e) {
        throw new ConfigurationFault(ec.key, "Invalid event definition: " + e.getMessage(), e);
      }
    }
    try {
      return new EventCatalog(events);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationFault(location, e.getMessage(), e);
    }
  }

  <T> T read(String location, Class<T> type) {
    try (InputStream in = open(location)) {
      return mapper.readValue(in, type);
    } catch (IOException e) {
      throw new ConfigurationFault(location, "Cannot read " + type.getSimpleName() + ": " + e.getMessage(), e);
    }
  }

  static InputStream open(String location) throws IOException {
    if (location == null || location.isBlank()) {
      throw new IOException("No location given");
    }
    if (location.startsWith(CLASSPATH_PREFIX)) {
      String resource = location.substring(CLASSPATH_PREFIX.length());
      InputStream in = CatalogLoader.class.getClassLoader().getResourceAsStream(resource);
      if (in == null) throw new IOException("Classpath resource not found: " + resource);
      return in;
    }
    Path path = Path.of(location);
    if (!Files.exists(path)) throw new IOException("File not found: " + path);
    return Files.newInputStream(path);
  }

  static EffectVector toEffect(EffectConfig ec) {
    if (ec == null) return EffectVector.EMPTY;
    return new EffectVector(ec.growth, ec.unemployment, ec.inflation, ec.budget, ec.opinion);
  }

  private static <E extends Enum<E>> E parseEnum(Class<E> type, String raw, String owner) {
    if (raw == null) throw new IllegalArgumentException(type.getSimpleName() + " is required for " + owner);
    try {
      return Enum.valueOf(type, raw.trim().toUpperCase());
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown " + type.getSimpleName() + " '" + raw + "' for " + owner);
    }
  }

  public static class EffectConfig {
    public double growth;
    public double unemployment;
    public double inflation;
    public double budget;
    public Map<String, Double> opinion;
  }

  public static class PolicyConfig {
    public String key;
    public String title;
    public String level;
    public String issue;
    public double direction;
    public double cost;
    public EffectConfig effect;
  }

  public static class ConditionConfig {
    public String metric;
    public String region;
    public boolean above;
    public double threshold;
  }

  public static class ConsequenceConfig {
    public String type;
    public String target;
    public int delayMonths;
    public Double probability;
    public double amount;
  }

  public static class EventConfig {
    public String key;
    public String name;
    public String description;
    public Double weight;
    public String trigger;
    public ConditionConfig condition;
    public int month;
    public int yearModulo;
    public EffectConfig effect;
    public List<String> regions;
    public boolean recurring;
    public int cooldownTurns;
    public List<ConsequenceConfig> consequences;
  }
}
