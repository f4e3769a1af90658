package com.oplogtail.core.model;

import java.io.Serial;
import java.io.Serializable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/** A (database, collection) pair. A null collection addresses the whole database. */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Namespace implements Serializable {

  @Serial private static final long serialVersionUID = 1L;

  static final String COMMAND_COLLECTION = "$cmd";

  String database;
  String collection;

  public static Namespace of(String database, String collection) {
    if (database == null || database.isBlank()) {
      throw new IllegalArgumentException("database must not be null or blank");
    }
    return new Namespace(database, collection);
  }

  public static Namespace database(String database) {
    return of(database, null);
  }

  /** Parses {@code db.collection}; the collection part may itself contain dots. */
  public static Namespace parse(String ns) {
    if (ns == null || ns.isBlank()) {
      throw new IllegalArgumentException("namespace must not be null or blank");
    }
    int dot = ns.indexOf('.');
    if (dot <= 0 || dot == ns.length() - 1) {
      throw new IllegalArgumentException("Invalid namespace: " + ns);
    }
    return new Namespace(ns.substring(0, dot), ns.substring(dot + 1));
  }

  public boolean isDatabaseLevel() {
    return collection == null;
  }

  public boolean isCommand() {
    return COMMAND_COLLECTION.equals(collection);
  }

  public boolean isSystem() {
    return collection != null && collection.startsWith("system.");
  }

  public Namespace withCollection(String collection) {
    return new Namespace(database, collection);
  }

  @Override
  public String toString() {
    return collection == null ? database : database + "." + collection;
  }
}
