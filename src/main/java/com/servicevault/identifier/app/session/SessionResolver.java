package com.servicevault.identifier.app.session;

/** Resolves an owner session token, issued by the authentication subsystem, to an account id. */
public interface SessionResolver {

  /**
   * @return the account id, or {@code null} when the session is unknown or expired
   */
  String resolveUserId(String sessionToken);
}
