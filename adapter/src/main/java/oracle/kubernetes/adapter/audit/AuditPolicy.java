// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.audit;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import oracle.kubernetes.adapter.security.RequestAttributes;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

/**
 * An ordered list of rules which decide the audit level of each request. The first rule that
 * matches a request decides; a request that matches no rule is not audited.
 */
public class AuditPolicy {

  static final String POLICY_KIND = "Policy";

  static final List<String> KNOWN_STAGES =
        List.of("RequestReceived", "ResponseStarted", "ResponseComplete", "Panic");

  private final List<Rule> rules;
  private final List<String> omitStages;

  public AuditPolicy(List<Rule> rules) {
    this(rules, Collections.emptyList());
  }

  /**
   * Creates a policy.
   * @param rules the rules, in the order they are tried
   * @param omitStages stages for which no event is recorded, whatever rule matches
   */
  public AuditPolicy(List<Rule> rules, List<String> omitStages) {
    this.rules = List.copyOf(rules);
    this.omitStages = List.copyOf(omitStages);
  }

  public List<Rule> getRules() {
    return rules;
  }

  /**
   * Reads a policy from a YAML file in the audit.k8s.io Policy format.
   * @param policyFile the file to read
   * @return the policy
   * @throws IOException if the file cannot be read or does not describe a valid policy
   */
  public static AuditPolicy load(File policyFile) throws IOException {
    try (Reader reader = Files.newBufferedReader(policyFile.toPath(), StandardCharsets.UTF_8)) {
      Object document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
      return fromMap(asMap(document, policyFile.getPath()), policyFile.getPath());
    } catch (RuntimeException e) {
      throw new IOException("failed to parse audit policy file " + policyFile + ": " + e.getMessage(), e);
    }
  }

  private static AuditPolicy fromMap(Map<String, Object> document, String source) throws IOException {
    if (!POLICY_KIND.equals(document.get("kind"))) {
      throw new IOException("audit policy file " + source + " must have kind " + POLICY_KIND);
    }
    List<Rule> rules = new ArrayList<>();
    for (Object rule : asList(document.get("rules"))) {
      rules.add(Rule.fromMap(asMap(rule, source), source));
    }
    if (rules.isEmpty()) {
      throw new IOException("loaded illegal policy with 0 rules from file " + source);
    }
    return new AuditPolicy(rules, toStages(document.get("omitStages"), source));
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> asMap(Object value, String source) throws IOException {
    if (!(value instanceof Map)) {
      throw new IOException("unexpected content in audit policy file " + source);
    }
    return (Map<String, Object>) value;
  }

  @SuppressWarnings("unchecked")
  private static List<Object> asList(Object value) {
    return value instanceof List ? (List<Object>) value : Collections.emptyList();
  }

  private static List<String> toStrings(Object value) {
    List<String> result = new ArrayList<>();
    asList(value).forEach(v -> result.add(String.valueOf(v)));
    return result;
  }

  private static List<String> toStages(Object value, String source) throws IOException {
    List<String> stages = toStrings(value);
    for (String stage : stages) {
      if (!KNOWN_STAGES.contains(stage)) {
        throw new IOException("unknown audit stage " + stage + " in audit policy file " + source);
      }
    }
    return stages;
  }

  /**
   * Returns the level at which the specified request should be audited.
   * @param attributes the request
   * @return the level of the first matching rule, or {@link AuditLevel#NONE}
   */
  public AuditLevel levelFor(RequestAttributes attributes) {
    return findRule(attributes).map(Rule::getLevel).orElse(AuditLevel.NONE);
  }

  /**
   * Returns true if no event should be recorded for the request at the specified stage. Stages
   * omitted by the policy apply to every request; those of the matching rule are added to them.
   * @param attributes the request
   * @param stage the name of an audit stage, such as ResponseComplete
   */
  public boolean isStageOmitted(RequestAttributes attributes, String stage) {
    return omitStages.contains(stage)
          || findRule(attributes).map(rule -> rule.omitStages.contains(stage)).orElse(false);
  }

  private Optional<Rule> findRule(RequestAttributes attributes) {
    return rules.stream().filter(rule -> rule.matches(attributes)).findFirst();
  }

  /** A group of API resources a rule applies to. */
  public static class GroupResources {
    private final String group;
    private final List<String> resources;
    private final List<String> resourceNames;

    GroupResources(String group, List<String> resources, List<String> resourceNames) {
      this.group = group;
      this.resources = List.copyOf(resources);
      this.resourceNames = List.copyOf(resourceNames);
    }

    static GroupResources fromMap(Map<String, Object> map) {
      return new GroupResources(Optional.ofNullable(map.get("group")).map(String::valueOf).orElse(""),
            toStrings(map.get("resources")), toStrings(map.get("resourceNames")));
    }

    public String getGroup() {
      return group;
    }

    public List<String> getResources() {
      return resources;
    }

    public List<String> getResourceNames() {
      return resourceNames;
    }
  }

  public static class Rule {
    private final AuditLevel level;
    private final List<String> users;
    private final List<String> userGroups;
    private final List<String> verbs;
    private final List<GroupResources> resources;
    private final List<String> namespaces;
    private final List<String> nonResourceUrls;
    private final List<String> omitStages;

    private Rule(Map<String, Object> map, String source) throws IOException {
      this.level = AuditLevel.fromValue(String.valueOf(map.get("level")));
      this.users = toStrings(map.get("users"));
      this.userGroups = toStrings(map.get("userGroups"));
      this.verbs = toStrings(map.get("verbs"));
      this.resources = new ArrayList<>();
      for (Object groupResources : asList(map.get("resources"))) {
        resources.add(GroupResources.fromMap(asMap(groupResources, source)));
      }
      this.namespaces = toStrings(map.get("namespaces"));
      this.nonResourceUrls = toStrings(map.get("nonResourceURLs"));
      this.omitStages = toStages(map.get("omitStages"), source);
      if (!nonResourceUrls.isEmpty() && (!resources.isEmpty() || !namespaces.isEmpty())) {
        throw new IOException("rules cannot apply to both regular resources and non-resource URLs in "
              + "audit policy file " + source);
      }
    }

    static Rule fromMap(Map<String, Object> map, String source) throws IOException {
      return new Rule(map, source);
    }

    public AuditLevel getLevel() {
      return level;
    }

    public List<GroupResources> getResources() {
      return Collections.unmodifiableList(resources);
    }

    public List<String> getNamespaces() {
      return namespaces;
    }

    public List<String> getOmitStages() {
      return omitStages;
    }

    // Requests served here are all non-resource requests, so rules scoped to resources or
    // namespaces never match them.
    boolean matches(RequestAttributes attributes) {
      return resources.isEmpty()
            && namespaces.isEmpty()
            && (users.isEmpty() || users.contains(attributes.getUser().getName()))
            && (userGroups.isEmpty() || attributes.getUser().getGroups().stream().anyMatch(userGroups::contains))
            && (verbs.isEmpty() || verbs.contains(attributes.getVerb()))
            && (nonResourceUrls.isEmpty()
                || nonResourceUrls.stream().anyMatch(u -> pathMatches(u, attributes.getPath())));
    }

    private static boolean pathMatches(String pattern, String path) {
      if (pattern.endsWith("*")) {
        return path.startsWith(pattern.substring(0, pattern.length() - 1));
      }
      return pattern.equals(path);
    }
  }
}
