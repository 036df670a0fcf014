package com.codeheadsystems.sealedbid.ledger;

import com.codeheadsystems.sealedbid.common.Principal;
import java.math.BigInteger;
import java.util.Map;

/**
 * Amounts owed to principals that were outbid, held until they withdraw them.
 * <p>
 * Implementations need not be thread-safe; access is serialized by the auction manager.
 */
public interface WithdrawalLedger {

  /**
   * Adds {@code amount} to what the principal is owed.
   *
   * @param principal the principal
   * @param amount    a non-negative amount
   */
  void credit(Principal principal, BigInteger amount);

  /**
   * What the principal is currently owed.
   *
   * @param principal the principal
   * @return the amount, zero if nothing is owed
   */
  BigInteger owed(Principal principal);

  /**
   * Reads and zeroes the principal's entry in one step.
   *
   * @param principal the principal
   * @return the amount that was owed
   */
  BigInteger take(Principal principal);

  /**
   * Sum of all outstanding entries.
   *
   * @return the total
   */
  BigInteger totalOutstanding();

  /**
   * Snapshot of every non-zero entry.
   *
   * @return the balances
   */
  Map<Principal, BigInteger> balances();
}
