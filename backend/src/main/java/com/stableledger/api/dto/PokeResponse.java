package com.stableledger.api.dto;

/**
 * {@code recorded} is false when the pair's newer observation was less than a period old.
 */
public record PokeResponse(String pairId, boolean recorded) {
}
