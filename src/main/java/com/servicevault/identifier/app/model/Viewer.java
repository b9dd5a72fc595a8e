package com.servicevault.identifier.app.model;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/** Who is asking: an authenticated owner session or an anonymous QR scan. */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class Viewer {

  public enum Kind {
    OWNER,
    PUBLIC
  }

  private final Kind kind;

  /** Authenticated account id, OWNER only. */
  private final String userId;

  /** Token presented by a public caller; {@code null} on the single-asset path. */
  private final String token;

  public static Viewer owner(String userId) {
    return new Viewer(Kind.OWNER, userId, null);
  }

  public static Viewer anonymous(String token) {
    return new Viewer(Kind.PUBLIC, null, token);
  }

  public boolean isOwnerOf(Property property) {
    return kind == Kind.OWNER && property != null && property.isOwnedBy(userId);
  }
}
