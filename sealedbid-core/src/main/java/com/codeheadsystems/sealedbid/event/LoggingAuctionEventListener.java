package com.codeheadsystems.sealedbid.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every event to the application log.
 */
public class LoggingAuctionEventListener implements AuctionEventListener {

  private static final Logger log = LoggerFactory.getLogger(LoggingAuctionEventListener.class);

  @Override
  public void onHighestBidIncreased(HighestBidIncreased event) {
    log.info("HighestBidIncreased(bidder={}, amount={})", event.bidder(), event.amount());
  }

  @Override
  public void onAuctionEnded(AuctionEnded event) {
    log.info("AuctionEnded(winner={}, amount={})", event.winner(), event.amount());
  }
}
