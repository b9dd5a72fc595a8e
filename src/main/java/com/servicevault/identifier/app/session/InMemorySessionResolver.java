package com.servicevault.identifier.app.session;

import java.util.concurrent.ConcurrentHashMap;

/** Session table for local runs and tests. */
public class InMemorySessionResolver implements SessionResolver {

  private final ConcurrentHashMap<String, String> tokenToUser = new ConcurrentHashMap<>();

  public void bind(String sessionToken, String userId) {
    tokenToUser.put(sessionToken, userId);
  }

  @Override
  public String resolveUserId(String sessionToken) {
    if (sessionToken == null) return null;
    return tokenToUser.get(sessionToken);
  }

  public void revoke(String sessionToken) {
    tokenToUser.remove(sessionToken);
  }
}
