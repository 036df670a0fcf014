package com.codeheadsystems.sealedbid.cli;

import com.codeheadsystems.sealedbid.auction.AuctionConfig;
import com.codeheadsystems.sealedbid.auction.RevealResult;
import com.codeheadsystems.sealedbid.cli.model.Opening;
import com.codeheadsystems.sealedbid.cli.model.Scenario;
import com.codeheadsystems.sealedbid.cli.model.ScenarioReport;
import com.codeheadsystems.sealedbid.cli.model.ScenarioStep;
import com.codeheadsystems.sealedbid.cli.model.SnapshotView;
import com.codeheadsystems.sealedbid.cli.model.StepOutcome;
import com.codeheadsystems.sealedbid.commitment.Commitment;
import com.codeheadsystems.sealedbid.commitment.CommitmentHasher;
import com.codeheadsystems.sealedbid.commitment.RevealedBid;
import com.codeheadsystems.sealedbid.commitment.Secrets;
import com.codeheadsystems.sealedbid.common.Principal;
import com.codeheadsystems.sealedbid.escrow.InMemoryEscrow;
import com.codeheadsystems.sealedbid.event.AuctionEnded;
import com.codeheadsystems.sealedbid.event.LoggingAuctionEventListener;
import com.codeheadsystems.sealedbid.exceptions.AuctionException;
import com.codeheadsystems.sealedbid.manager.SealedBidAuctionManager;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays a {@link Scenario} against a fresh auction backed by an {@link InMemoryEscrow}.
 * <p>
 * Each step runs at {@code start + at} seconds. A step that fails with an auction error or an
 * invalid argument is recorded as failed and the run moves on to the next step.
 */
public class ScenarioRunner {

  private static final Logger log = LoggerFactory.getLogger(ScenarioRunner.class);

  /**
   * Runs the scenario.
   *
   * @param scenario the scenario
   * @return the report
   */
  public ScenarioReport run(Scenario scenario) {
    Instant start = parseStart(scenario.start());
    ScriptedClock clock = new ScriptedClock(start);
    InMemoryEscrow escrow = new InMemoryEscrow();
    scenario.wallets().forEach((id, amount) -> escrow.fund(Principal.of(id), amount));

    AuctionConfig config = AuctionConfig.starting(start,
        Duration.ofSeconds(scenario.biddingSeconds()),
        Duration.ofSeconds(scenario.revealSeconds()),
        Principal.of(scenario.beneficiary()));
    SealedBidAuctionManager manager =
        new SealedBidAuctionManager(config, clock, escrow, new LoggingAuctionEventListener());

    List<StepOutcome> outcomes = new ArrayList<>();
    for (ScenarioStep step : scenario.steps()) {
      clock.set(start.plusSeconds(step.at()));
      String phase = manager.phase().name();
      try {
        String result = execute(step, manager, escrow);
        outcomes.add(new StepOutcome(step.at(), step.action(), step.principal(), phase, true, result, null));
      } catch (AuctionException | IllegalArgumentException e) {
        log.warn("Step at {}s ({}) failed: {}", step.at(), step.action(), e.getMessage());
        outcomes.add(new StepOutcome(step.at(), step.action(), step.principal(), phase, false, null,
            e.getClass().getSimpleName() + ": " + e.getMessage()));
      }
    }

    Map<String, BigInteger> wallets = new TreeMap<>();
    escrow.wallets().forEach((principal, amount) -> wallets.put(principal.id(), amount));
    return new ScenarioReport(outcomes, new SnapshotView(manager.snapshot()), wallets, escrow.held());
  }

  private String execute(ScenarioStep step, SealedBidAuctionManager manager, InMemoryEscrow escrow) {
    switch (step.action()) {
      case BID: {
        Principal principal = principal(step);
        BigInteger deposit = required(step.deposit(), "deposit");
        int index = manager.bid(principal, commitmentOf(step), deposit);
        return "bid " + index + " recorded with deposit " + deposit;
      }
      case REVEAL: {
        List<RevealedBid> openings = new ArrayList<>(step.reveals().size());
        for (Opening opening : step.reveals()) {
          openings.add(new RevealedBid(required(opening.value(), "reveals.value"), opening.fake(),
              secretOf(required(opening.secret(), "reveals.secret"))));
        }
        RevealResult result = manager.reveal(principal(step), openings);
        return "refund " + result.refund()
            + ", verified " + result.verifiedIndices()
            + ", unverified " + result.unverifiedIndices()
            + ", accepted " + result.acceptedIndices();
      }
      case WITHDRAW:
        return "paid " + manager.withdraw(principal(step));
      case END: {
        AuctionEnded ended = manager.end();
        return "winner " + ended.winnerIfPresent().map(Principal::id).orElse("none")
            + ", amount " + ended.amount();
      }
      case REJECT_TRANSFERS:
        escrow.rejectTransfersTo(principal(step));
        return "transfers to " + step.principal() + " rejected";
      case ACCEPT_TRANSFERS:
        escrow.acceptTransfersTo(principal(step));
        return "transfers to " + step.principal() + " accepted";
      default:
        throw new IllegalArgumentException("Unsupported action: " + step.action());
    }
  }

  private static Commitment commitmentOf(ScenarioStep step) {
    if (step.commitment() != null) {
      return Commitment.fromHex(step.commitment());
    }
    return CommitmentHasher.commit(required(step.value(), "value"), step.fake(),
        secretOf(required(step.secret(), "secret")));
  }

  /**
   * Decodes a scenario secret: {@code 0x}-prefixed hex is a raw 32-byte secret, anything else
   * is text. A prefixed value that is not 32 hex bytes is rejected rather than read as text.
   *
   * @param secret the secret as written in the scenario
   * @return the 32 secret bytes
   */
  static byte[] secretOf(String secret) {
    if (secret.startsWith("0x")) {
      return Secrets.fromHex(secret);
    }
    return Secrets.fromText(secret);
  }

  private static Principal principal(ScenarioStep step) {
    return Principal.of(required(step.principal(), "principal"));
  }

  private static <T> T required(T value, String field) {
    if (value == null) {
      throw new IllegalArgumentException("Missing required field: " + field);
    }
    return value;
  }

  private static Instant parseStart(String start) {
    if (start == null) {
      return Instant.EPOCH;
    }
    try {
      return Instant.parse(start);
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid start instant: " + start, e);
    }
  }
}
