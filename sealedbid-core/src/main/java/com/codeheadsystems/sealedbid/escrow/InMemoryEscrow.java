package com.codeheadsystems.sealedbid.escrow;

import com.codeheadsystems.sealedbid.common.Amounts;
import com.codeheadsystems.sealedbid.common.Principal;
import com.codeheadsystems.sealedbid.exceptions.TransferFailureException;
import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link EscrowTransfer} that keeps a wallet balance per principal and
 * a single custody balance for the auction.
 * <p>
 * Destinations can be told to reject incoming transfers, which lets callers exercise the
 * engine's failure handling deterministically. Suitable for development, simulation and tests
 * only.
 */
public class InMemoryEscrow implements EscrowTransfer {

  private static final Logger log = LoggerFactory.getLogger(InMemoryEscrow.class);

  private final Map<Principal, BigInteger> wallets = new ConcurrentHashMap<>();
  private final Set<Principal> rejecting = ConcurrentHashMap.newKeySet();
  private BigInteger held = BigInteger.ZERO;
  private BigInteger totalDeposited = BigInteger.ZERO;
  private BigInteger totalPaidOut = BigInteger.ZERO;

  public InMemoryEscrow() {
    log.warn("Using InMemoryEscrow: balances are simulated and will NOT survive restarts.");
  }

  /**
   * Credits a principal's wallet from outside the auction.
   *
   * @param principal the principal
   * @param amount    the amount
   */
  public synchronized void fund(Principal principal, BigInteger amount) {
    Objects.requireNonNull(principal, "principal");
    Amounts.requireUnsigned(amount, "amount");
    wallets.merge(principal, amount, BigInteger::add);
  }

  /**
   * Makes every subsequent transfer to the principal fail until {@link #acceptTransfersTo} is called.
   *
   * @param principal the principal
   */
  public void rejectTransfersTo(Principal principal) {
    rejecting.add(principal);
  }

  /**
   * Accept transfers to.
   *
   * @param principal the principal
   */
  public void acceptTransfersTo(Principal principal) {
    rejecting.remove(principal);
  }

  @Override
  public synchronized void deposit(Principal from, BigInteger amount) {
    Objects.requireNonNull(from, "from");
    Amounts.requireUnsigned(amount, "amount");
    BigInteger balance = balanceOf(from);
    if (balance.compareTo(amount) < 0) {
      throw new TransferFailureException(from, amount,
          "Insufficient funds: " + from + " holds " + balance + ", needs " + amount);
    }
    wallets.put(from, balance.subtract(amount));
    held = held.add(amount);
    totalDeposited = totalDeposited.add(amount);
    log.debug("deposit(from={}, amount={}) held={}", from, amount, held);
  }

  @Override
  public synchronized void transfer(Principal to, BigInteger amount) {
    Objects.requireNonNull(to, "to");
    Amounts.requireUnsigned(amount, "amount");
    if (rejecting.contains(to)) {
      throw new TransferFailureException(to, amount, "Destination " + to + " rejected transfer of " + amount);
    }
    if (held.compareTo(amount) < 0) {
      // Custody can only underflow if the caller's accounting is broken.
      throw new IllegalStateException("Escrow holds " + held + ", cannot release " + amount);
    }
    held = held.subtract(amount);
    totalPaidOut = totalPaidOut.add(amount);
    wallets.merge(to, amount, BigInteger::add);
    log.debug("transfer(to={}, amount={}) held={}", to, amount, held);
  }

  /**
   * Wallet balance of a principal.
   *
   * @param principal the principal
   * @return the balance, zero if never funded
   */
  public BigInteger balanceOf(Principal principal) {
    return wallets.getOrDefault(principal, BigInteger.ZERO);
  }

  /**
   * Value currently in custody.
   *
   * @return the held amount
   */
  public synchronized BigInteger held() {
    return held;
  }

  public synchronized BigInteger totalDeposited() {
    return totalDeposited;
  }

  public synchronized BigInteger totalPaidOut() {
    return totalPaidOut;
  }

  /**
   * Snapshot of all wallet balances.
   *
   * @return the balances
   */
  public Map<Principal, BigInteger> wallets() {
    return Map.copyOf(wallets);
  }
}
