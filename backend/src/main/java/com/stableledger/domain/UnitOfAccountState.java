package com.stableledger.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * PCE base and recent values of the inflation-indexed unit of account. The base is fixed by the first
 * refresh and survives restarts; {@code updates} is oldest first.
 */
@Document(collection = "unit_of_account")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class UnitOfAccountState {

    public static final String GLOBAL_ID = "global";

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private BigDecimal pceBase;
    private List<Update> updates = new ArrayList<>();

    public UnitOfAccountState(BigDecimal pceBase) {
        this.id = GLOBAL_ID;
        this.pceBase = pceBase;
    }

    public record Update(Instant timestamp, BigDecimal value, BigDecimal pce) {
    }
}
