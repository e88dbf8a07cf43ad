package ussim.config;

import ussim.domain.PolicyLevel;
import ussim.domain.PolicyTemplate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public class PolicyCatalog {
  private final Map<String, PolicyTemplate> templates = new TreeMap<>();

  public PolicyCatalog(Collection<PolicyTemplate> templates) {
    for (PolicyTemplate template : templates) {
      if (this.templates.putIfAbsent(template.key(), template) != null) {
        throw new IllegalArgumentException("Duplicate policy template: " + template.key());
      }
    }
  }

  public static PolicyCatalog empty() {
    return new PolicyCatalog(List.of());
  }

  public PolicyTemplate get(String key) {
    return templates.get(key);
  }

  public Collection<PolicyTemplate> all() {
    return Collections.unmodifiableCollection(templates.values());
  }

  public List<PolicyTemplate> byLevel(PolicyLevel level) {
    List<PolicyTemplate> out = new ArrayList<>();
    for (PolicyTemplate template : templates.values()) {
      if (template.level() == level) out.add(template);
    }
    return out;
  }
}
