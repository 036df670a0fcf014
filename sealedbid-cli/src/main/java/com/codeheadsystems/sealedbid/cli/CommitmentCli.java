package com.codeheadsystems.sealedbid.cli;

import com.codeheadsystems.sealedbid.commitment.Commitment;
import com.codeheadsystems.sealedbid.commitment.CommitmentHasher;
import com.codeheadsystems.sealedbid.commitment.Secrets;
import java.io.PrintStream;
import java.math.BigInteger;
import java.security.SecureRandom;
import org.bouncycastle.util.encoders.Hex;

/**
 * Computes the commitment a bidder submits with {@code bid}.
 *
 * <pre>
 * Usage:
 *   java -cp sealedbid-cli.jar com.codeheadsystems.sealedbid.cli.CommitmentCli &lt;value&gt; &lt;true|false&gt; [&lt;secret&gt;] [--hex]
 *
 * Examples:
 *   CommitmentCli 10 false s1
 *   CommitmentCli 0 true                 (decoy with a generated secret)
 *   CommitmentCli 10 false 0x5c1e...     --hex
 * </pre>
 *
 * <p>Without a secret a random 32-byte one is generated and printed; keep it, the reveal needs
 * it. A textual secret is UTF-8 encoded and zero-padded to 32 bytes. With {@code --hex} the
 * secret is read as 32 hex-encoded bytes instead.
 */
public class CommitmentCli {

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    int status = run(args, System.out, System.err);
    if (status != 0) {
      System.exit(status);
    }
  }

  /**
   * Parses the arguments and prints the commitment.
   *
   * @param args the arguments
   * @param out  where results go
   * @param err  where usage and errors go
   * @return the exit status
   */
  static int run(String[] args, PrintStream out, PrintStream err) {
    boolean hex = false;
    String value = null;
    String fake = null;
    String secret = null;

    for (String arg : args) {
      if ("--hex".equals(arg)) {
        hex = true;
      } else if (value == null) {
        value = arg;
      } else if (fake == null) {
        fake = arg;
      } else if (secret == null) {
        secret = arg;
      } else {
        return usage(err);
      }
    }

    if (value == null || fake == null || !("true".equals(fake) || "false".equals(fake))) {
      return usage(err);
    }

    try {
      BigInteger amount = new BigInteger(value);
      byte[] secretBytes;
      if (secret == null) {
        secretBytes = Secrets.random(new SecureRandom());
      } else if (hex) {
        secretBytes = Secrets.fromHex(secret);
      } else {
        secretBytes = Secrets.fromText(secret);
      }
      Commitment commitment = CommitmentHasher.commit(amount, Boolean.parseBoolean(fake), secretBytes);

      out.println("Value      : " + amount);
      out.println("Fake       : " + fake);
      out.println("Secret     : 0x" + Hex.toHexString(secretBytes));
      out.println("Commitment : 0x" + commitment.toHex());
      return 0;
    } catch (IllegalArgumentException e) {
      // NumberFormatException included
      err.println("Error: " + e.getMessage());
      return 1;
    }
  }

  private static int usage(PrintStream err) {
    err.println("Usage: CommitmentCli <value> <true|false> [<secret>] [--hex]");
    err.println();
    err.println("  <value>        bid value, a non-negative integer");
    err.println("  <true|false>   whether the bid is a decoy");
    err.println("  <secret>       text of at most 32 UTF-8 bytes; generated when omitted");
    err.println("  --hex          read <secret> as 32 hex-encoded bytes");
    return 1;
  }
}
