package com.codeheadsystems.sealedbid.commitment;

import com.codeheadsystems.sealedbid.common.Principal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link CommitmentStore}.
 * <p>
 * Bids live in one flat append-only arena; each principal keeps the ordered list of arena
 * slots holding its bids. All bids are lost when the process exits.
 */
public class InMemoryCommitmentStore implements CommitmentStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryCommitmentStore.class);

  private final List<Bid> arena = new ArrayList<>();
  // principal → arena slots, in bid order.
  private final Map<Principal, List<Integer>> slots = new LinkedHashMap<>();
  private BigInteger totalDeposits = BigInteger.ZERO;

  @Override
  public int append(Principal principal, Commitment commitment, BigInteger deposit) {
    Objects.requireNonNull(principal, "principal");
    Bid bid = new Bid(commitment, deposit);
    int slot = arena.size();
    arena.add(bid);
    List<Integer> owned = slots.computeIfAbsent(principal, k -> new ArrayList<>());
    owned.add(slot);
    totalDeposits = totalDeposits.add(deposit);
    log.debug("Stored bid {} for principal={} in slot {}", owned.size() - 1, principal, slot);
    return owned.size() - 1;
  }

  @Override
  public int count(Principal principal) {
    List<Integer> owned = slots.get(principal);
    return owned == null ? 0 : owned.size();
  }

  @Override
  public List<Bid> bids(Principal principal) {
    List<Integer> owned = slots.get(principal);
    if (owned == null) {
      return Collections.emptyList();
    }
    List<Bid> result = new ArrayList<>(owned.size());
    for (int slot : owned) {
      result.add(arena.get(slot));
    }
    return Collections.unmodifiableList(result);
  }

  @Override
  public void consume(Principal principal, int index) {
    List<Integer> owned = slots.get(principal);
    if (owned == null || index < 0 || index >= owned.size()) {
      throw new IndexOutOfBoundsException("No bid " + index + " for principal " + principal);
    }
    int slot = owned.get(index);
    arena.set(slot, arena.get(slot).consume());
  }

  @Override
  public Set<Principal> principals() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(slots.keySet()));
  }

  @Override
  public BigInteger totalDeposits() {
    return totalDeposits;
  }
}
