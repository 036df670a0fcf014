package com.codeheadsystems.sealedbid.event;

import com.codeheadsystems.sealedbid.common.Principal;
import java.math.BigInteger;

/**
 * Emitted each time a revealed bid becomes the new highest bid.
 *
 * @param bidder the new highest bidder
 * @param amount the new highest bid
 */
public record HighestBidIncreased(Principal bidder, BigInteger amount) {
}
