package com.codeheadsystems.sealedbid.commitment;

import com.codeheadsystems.sealedbid.common.Amounts;
import com.codeheadsystems.sealedbid.common.ByteUtils;
import java.math.BigInteger;
import java.util.Objects;
import org.bouncycastle.crypto.digests.KeccakDigest;

/**
 * Computes bid commitments.
 * <p>
 * The digest is Keccak-256 over the tight packing
 * {@code uint256 value (32 bytes, big-endian) || bool fake (1 byte) || bytes32 secret}, so a
 * commitment produced here is byte-identical to {@code keccak256(abi.encodePacked(value, fake,
 * secret))} computed by an Ethereum client.
 */
public class CommitmentHasher {

  /**
   * Secret length in bytes.
   */
  public static final int SECRET_LENGTH = 32;

  private static final int VALUE_LENGTH = 32;
  private static final byte TRUE = 0x01;
  private static final byte FALSE = 0x00;

  private CommitmentHasher() {
  }

  /**
   * Commits to a (value, fake, secret) triple.
   *
   * @param value  the bid value
   * @param fake   whether the bid is a decoy
   * @param secret 32-byte blinding secret
   * @return the commitment
   */
  public static Commitment commit(BigInteger value, boolean fake, byte[] secret) {
    Amounts.requireUnsigned(value, "value");
    requireSecret(secret);
    byte[] packed = ByteUtils.concat(
        ByteUtils.I2OSP(value, VALUE_LENGTH),
        new byte[]{fake ? TRUE : FALSE},
        secret);
    return new Commitment(keccak256(packed));
  }

  /**
   * Checks a revealed triple against a stored commitment. The consumed sentinel never matches.
   *
   * @param commitment the stored commitment
   * @param value      revealed value
   * @param fake       revealed fake flag
   * @param secret     revealed secret
   * @return whether the triple opens the commitment
   */
  public static boolean matches(Commitment commitment, BigInteger value, boolean fake, byte[] secret) {
    Objects.requireNonNull(commitment, "commitment");
    if (commitment.isConsumed()) {
      return false;
    }
    return commit(value, fake, secret).equals(commitment);
  }

  /**
   * Require secret byte [ ].
   *
   * @param secret the secret
   * @return the byte [ ]
   */
  public static byte[] requireSecret(byte[] secret) {
    Objects.requireNonNull(secret, "secret");
    if (secret.length != SECRET_LENGTH) {
      throw new IllegalArgumentException("Secret must be " + SECRET_LENGTH + " bytes, got " + secret.length);
    }
    return secret;
  }

  static byte[] keccak256(byte[] input) {
    KeccakDigest digest = new KeccakDigest(256);
    digest.update(input, 0, input.length);
    byte[] hash = new byte[digest.getDigestSize()];
    digest.doFinal(hash, 0);
    return hash;
  }
}
