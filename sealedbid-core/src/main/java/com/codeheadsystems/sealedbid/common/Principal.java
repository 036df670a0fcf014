package com.codeheadsystems.sealedbid.common;

import java.util.Objects;

/**
 * Opaque identifier of an auction participant, supplied by the execution environment.
 * <p>
 * The engine never authenticates a principal; it only compares identifiers.
 *
 * @param id non-blank identifier
 */
public record Principal(String id) {

  public Principal {
    Objects.requireNonNull(id, "id");
    if (id.isBlank()) {
      throw new IllegalArgumentException("Principal id must not be blank");
    }
  }

  /**
   * Of principal.
   *
   * @param id the id
   * @return the principal
   */
  public static Principal of(String id) {
    return new Principal(id);
  }

  @Override
  public String toString() {
    return id;
  }
}
