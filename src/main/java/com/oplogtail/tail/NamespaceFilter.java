package com.oplogtail.tail;

import com.oplogtail.core.model.Namespace;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Include/exclude filter over {@code database.collection} patterns. {@code *} matches any run of
 * characters within a part; a bare database name or {@code *} alone covers every collection.
 * An empty include list includes everything, and an exclude always wins.
 */
public final class NamespaceFilter {

  private static final Pattern VALID_DATABASE = Pattern.compile("[^\\s/\\\\.\"$]+");
  private static final Pattern VALID_COLLECTION = Pattern.compile("[^\\s$]+");

  private final List<Rule> includes;
  private final List<Rule> excludes;

  private NamespaceFilter(List<Rule> includes, List<Rule> excludes) {
    this.includes = includes;
    this.excludes = excludes;
  }

  public static NamespaceFilter acceptAll() {
    return new NamespaceFilter(List.of(), List.of());
  }

  /**
   * @throws IllegalArgumentException if any pattern is malformed
   */
  public static NamespaceFilter of(List<String> includePatterns, List<String> excludePatterns) {
    return new NamespaceFilter(parse(includePatterns), parse(excludePatterns));
  }

  public boolean test(Namespace namespace) {
    if (excludes.stream().anyMatch(rule -> rule.excludes(namespace))) {
      return false;
    }
    return includes.isEmpty() || includes.stream().anyMatch(rule -> rule.includes(namespace));
  }

  private static List<Rule> parse(List<String> patterns) {
    if (patterns == null) {
      return List.of();
    }
    return patterns.stream().map(Rule::parse).collect(Collectors.toUnmodifiableList());
  }

  private static final class Rule {

    private final String source;
    private final Pattern database;
    private final Pattern collection;
    private final boolean wholeDatabase;

    private Rule(String source, Pattern database, Pattern collection, boolean wholeDatabase) {
      this.source = source;
      this.database = database;
      this.collection = collection;
      this.wholeDatabase = wholeDatabase;
    }

    static Rule parse(String pattern) {
      if (pattern == null || pattern.isBlank()) {
        throw new IllegalArgumentException("Namespace pattern must not be null or blank");
      }
      String trimmed = pattern.trim();
      int dot = trimmed.indexOf('.');
      String dbPart = dot < 0 ? trimmed : trimmed.substring(0, dot);
      String collPart = dot < 0 ? "*" : trimmed.substring(dot + 1);
      if (!VALID_DATABASE.matcher(dbPart).matches()) {
        throw new IllegalArgumentException("Invalid database in namespace pattern: " + pattern);
      }
      if (!VALID_COLLECTION.matcher(collPart).matches()) {
        throw new IllegalArgumentException("Invalid collection in namespace pattern: " + pattern);
      }
      return new Rule(trimmed, glob(dbPart), glob(collPart), "*".equals(collPart));
    }

    boolean includes(Namespace ns) {
      if (!database.matcher(ns.getDatabase()).matches()) {
        return false;
      }
      return ns.isDatabaseLevel() || collection.matcher(ns.getCollection()).matches();
    }

    boolean excludes(Namespace ns) {
      if (!database.matcher(ns.getDatabase()).matches()) {
        return false;
      }
      // a database-level event is only excluded by a rule covering the whole database
      return ns.isDatabaseLevel() ? wholeDatabase : collection.matcher(ns.getCollection()).matches();
    }

    private static Pattern glob(String part) {
      String[] literals = part.split("\\*", -1);
      StringBuilder regex = new StringBuilder();
      for (int i = 0; i < literals.length; i++) {
        if (i > 0) {
          regex.append(".*");
        }
        if (!literals[i].isEmpty()) {
          regex.append(Pattern.quote(literals[i]));
        }
      }
      return Pattern.compile(regex.toString());
    }

    @Override
    public String toString() {
      return source;
    }
  }

  @Override
  public String toString() {
    return "NamespaceFilter(include=" + includes + ", exclude=" + excludes + ")";
  }
}
