package com.codeheadsystems.sealedbid.escrow;

import com.codeheadsystems.sealedbid.common.Principal;
import com.codeheadsystems.sealedbid.exceptions.TransferFailureException;
import java.math.BigInteger;

/**
 * Custody primitive through which all value enters and leaves the auction.
 * <p>
 * Both operations are all-or-nothing: when they throw, no value has moved.
 */
public interface EscrowTransfer {

  /**
   * Takes {@code amount} from the principal into custody.
   *
   * @param from   the paying principal
   * @param amount the amount
   * @throws TransferFailureException if the funds could not be collected
   */
  void deposit(Principal from, BigInteger amount);

  /**
   * Releases {@code amount} from custody to the principal.
   *
   * @param to     the receiving principal
   * @param amount the amount
   * @throws TransferFailureException if the destination rejected the funds
   */
  void transfer(Principal to, BigInteger amount);
}
