package com.codeheadsystems.sealedbid.cli.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigInteger;

/**
 * The cleartext of one sealed bid.
 *
 * @param value  the bid value
 * @param fake   whether the bid is a decoy
 * @param secret the secret; a value starting with {@code 0x} is always decoded as a raw 32-byte hex
 *               secret, so a text secret cannot begin with {@code 0x}; anything else is UTF-8
 *               text of at most 32 bytes
 */
public record Opening(@JsonProperty("value") BigInteger value,
                      @JsonProperty("fake") boolean fake,
                      @JsonProperty("secret") String secret) {
}
