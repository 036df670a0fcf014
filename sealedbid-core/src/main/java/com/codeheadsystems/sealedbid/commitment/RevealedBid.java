package com.codeheadsystems.sealedbid.commitment;

import com.codeheadsystems.sealedbid.common.Amounts;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

/**
 * The opening of one commitment, as disclosed during the reveal phase.
 *
 * @param value  claimed bid value
 * @param fake   whether the bid was a decoy
 * @param secret the 32-byte blinding secret
 */
public record RevealedBid(BigInteger value, boolean fake, byte[] secret) {

  public RevealedBid {
    Amounts.requireUnsigned(value, "value");
    secret = CommitmentHasher.requireSecret(secret).clone();
  }

  /**
   * Convenience factory taking a textual secret (see {@link Secrets#fromText(String)}).
   *
   * @param value  the value
   * @param fake   the fake flag
   * @param secret the secret text
   * @return the revealed bid
   */
  public static RevealedBid of(long value, boolean fake, String secret) {
    return new RevealedBid(BigInteger.valueOf(value), fake, Secrets.fromText(secret));
  }

  @Override
  public byte[] secret() {
    return secret.clone();
  }

  /**
   * The commitment this opening corresponds to.
   *
   * @return the commitment
   */
  public Commitment commitment() {
    return CommitmentHasher.commit(value, fake, secret);
  }

  /**
   * Whether this opening verifies against the stored commitment.
   *
   * @param stored the stored commitment
   * @return the boolean
   */
  public boolean opens(Commitment stored) {
    return CommitmentHasher.matches(stored, value, fake, secret);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof RevealedBid other
        && fake == other.fake
        && value.equals(other.value)
        && Arrays.equals(secret, other.secret);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, fake, Arrays.hashCode(secret));
  }

  // Secrets stay out of logs and exception messages.
  @Override
  public String toString() {
    return "RevealedBid[value=" + value + ", fake=" + fake + "]";
  }
}
