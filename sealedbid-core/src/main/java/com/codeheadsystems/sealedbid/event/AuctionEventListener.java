package com.codeheadsystems.sealedbid.event;

/**
 * Receives the auction's observable events. Called synchronously once the operation that
 * produced the event has finished changing state; implementations must not call back into the
 * auction. An exception thrown by a listener is logged and does not fail the operation.
 */
public interface AuctionEventListener {

  /**
   * A no-op listener.
   */
  AuctionEventListener NONE = new AuctionEventListener() {
  };

  default void onHighestBidIncreased(HighestBidIncreased event) {
  }

  default void onAuctionEnded(AuctionEnded event) {
  }
}
