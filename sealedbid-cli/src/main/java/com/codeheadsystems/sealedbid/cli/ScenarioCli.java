package com.codeheadsystems.sealedbid.cli;

import com.codeheadsystems.sealedbid.cli.model.Scenario;
import com.codeheadsystems.sealedbid.cli.model.ScenarioReport;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.File;
import java.io.IOException;

/**
 * Replays a scripted auction from a JSON file and prints the report as JSON.
 *
 * <pre>
 * Usage:
 *   java -cp sealedbid-cli.jar com.codeheadsystems.sealedbid.cli.ScenarioCli &lt;scenario.json&gt;
 * </pre>
 *
 * <p>Example scenario:
 * <pre>
 * {
 *   "beneficiary": "beneficiary",
 *   "biddingSeconds": 3600,
 *   "revealSeconds": 3600,
 *   "wallets": { "alice": 100 },
 *   "steps": [
 *     { "at": 0,    "action": "bid", "principal": "alice", "value": 10, "secret": "s1", "deposit": 15 },
 *     { "at": 3600, "action": "reveal", "principal": "alice",
 *       "reveals": [ { "value": 10, "fake": false, "secret": "s1" } ] },
 *     { "at": 7200, "action": "end" }
 *   ]
 * }
 * </pre>
 */
public class ScenarioCli {

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    if (args.length != 1) {
      System.err.println("Usage: ScenarioCli <scenario.json>");
      System.exit(1);
    }

    ObjectMapper mapper = new ObjectMapper();
    try {
      Scenario scenario = mapper.readValue(new File(args[0]), Scenario.class);
      ScenarioReport report = new ScenarioRunner().run(scenario);
      System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
    } catch (IOException | IllegalArgumentException e) {
      System.err.println("Error: " + e.getMessage());
      System.exit(1);
    }
  }
}
