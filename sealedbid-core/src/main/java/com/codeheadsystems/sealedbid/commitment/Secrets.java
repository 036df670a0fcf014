package com.codeheadsystems.sealedbid.commitment;

import static com.codeheadsystems.sealedbid.commitment.CommitmentHasher.SECRET_LENGTH;

import com.codeheadsystems.sealedbid.common.ByteUtils;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Objects;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

/**
 * Factory methods for 32-byte bid secrets.
 */
public class Secrets {

  private Secrets() {
  }

  /**
   * UTF-8 encodes the text and right-pads it with zeros, the {@code bytes32} layout an Ethereum
   * client produces for a short string.
   *
   * @param text at most 32 bytes of UTF-8
   * @return the secret
   */
  public static byte[] fromText(String text) {
    Objects.requireNonNull(text, "text");
    byte[] raw = text.getBytes(StandardCharsets.UTF_8);
    if (raw.length > SECRET_LENGTH) {
      throw new IllegalArgumentException("Secret text exceeds " + SECRET_LENGTH + " bytes when UTF-8 encoded");
    }
    return ByteUtils.rightPad(raw, SECRET_LENGTH);
  }

  /**
   * Decodes a 32-byte hex secret; an optional {@code 0x} prefix is accepted.
   *
   * @param hex the hex string
   * @return the secret
   */
  public static byte[] fromHex(String hex) {
    Objects.requireNonNull(hex, "hex");
    String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
    try {
      return CommitmentHasher.requireSecret(Hex.decode(digits));
    } catch (DecoderException e) {
      throw new IllegalArgumentException("Secret is not valid hex", e);
    }
  }

  /**
   * Generates a fresh random secret.
   *
   * @param random the random source
   * @return the secret
   */
  public static byte[] random(SecureRandom random) {
    byte[] out = new byte[SECRET_LENGTH];
    random.nextBytes(out);
    return out;
  }
}
