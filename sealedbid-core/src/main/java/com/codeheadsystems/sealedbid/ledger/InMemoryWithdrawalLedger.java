package com.codeheadsystems.sealedbid.ledger;

import com.codeheadsystems.sealedbid.common.Amounts;
import com.codeheadsystems.sealedbid.common.Principal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link WithdrawalLedger}. Zeroed entries are removed.
 */
public class InMemoryWithdrawalLedger implements WithdrawalLedger {

  private static final Logger log = LoggerFactory.getLogger(InMemoryWithdrawalLedger.class);

  private final Map<Principal, BigInteger> owed = new LinkedHashMap<>();
  private BigInteger totalOutstanding = BigInteger.ZERO;

  @Override
  public void credit(Principal principal, BigInteger amount) {
    Objects.requireNonNull(principal, "principal");
    Amounts.requireUnsigned(amount, "amount");
    if (amount.signum() == 0) {
      return;
    }
    owed.merge(principal, amount, BigInteger::add);
    totalOutstanding = totalOutstanding.add(amount);
    log.debug("Credited {} to principal={}, now owed {}", amount, principal, owed.get(principal));
  }

  @Override
  public BigInteger owed(Principal principal) {
    return owed.getOrDefault(principal, BigInteger.ZERO);
  }

  @Override
  public BigInteger take(Principal principal) {
    BigInteger amount = owed.remove(principal);
    if (amount == null) {
      return BigInteger.ZERO;
    }
    totalOutstanding = totalOutstanding.subtract(amount);
    return amount;
  }

  @Override
  public BigInteger totalOutstanding() {
    return totalOutstanding;
  }

  @Override
  public Map<Principal, BigInteger> balances() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(owed));
  }
}
