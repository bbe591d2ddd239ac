package com.flamingo.ai.mano.cache;

import java.util.UUID;

/** Builds user-scoped keys for {@link ContextCache}. */
public final class CacheKeys {

  private static final int QUERY_PREFIX_LENGTH = 50;

  private CacheKeys() {}

  public static String userPrefix(String userId) {
    return userId + ":";
  }

  public static String people(String userId) {
    return userPrefix(userId) + "people";
  }

  public static String themes(String userId) {
    return userPrefix(userId) + "themes";
  }

  public static String challenges(String userId) {
    return userPrefix(userId) + "challenges";
  }

  public static String patterns(String userId) {
    return userPrefix(userId) + "patterns";
  }

  /** Semantic search results are keyed by the first 50 characters of the query and the scope. */
  public static String semantic(String userId, String query, UUID scopePersonId) {
    String trimmed = query == null ? "" : query.trim();
    String prefix =
        trimmed.length() > QUERY_PREFIX_LENGTH
            ? trimmed.substring(0, QUERY_PREFIX_LENGTH)
            : trimmed;
    String key = userPrefix(userId) + "semantic:" + prefix;
    return scopePersonId != null ? key + ":" + scopePersonId : key;
  }
}
