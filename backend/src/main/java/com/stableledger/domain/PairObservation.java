package com.stableledger.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigInteger;

/**
 * Two observation slots of one trading pair. Created on the first update, then only overwritten.
 * {@code older.timestamp <= newer.timestamp} whenever both are present.
 */
@Document(collection = "pair_observations")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PairObservation {

    @Id
    @EqualsAndHashCode.Include
    private String pairId;
    private Observation older;
    private Observation newer;

    public PairObservation(String pairId, Observation newer) {
        this.pairId = pairId;
        this.newer = newer;
    }

    /** Moves {@code newer} into {@code older} and stores the candidate as {@code newer}. */
    public void shift(Observation candidate) {
        if (newer != null && candidate.timestamp() < newer.timestamp()) {
            throw new IllegalArgumentException("Observation for " + pairId + " goes back in time");
        }
        this.older = this.newer;
        this.newer = candidate;
    }

    /**
     * @param timestamp   epoch seconds
     * @param accumulator cumulative UQ112x112 price × seconds
     */
    public record Observation(long timestamp, BigInteger accumulator) {
    }
}
