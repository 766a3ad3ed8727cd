package com.stableledger.config;

import com.stableledger.domain.CollateralPosition;
import com.stableledger.domain.CollateralPositionRepository;
import com.stableledger.domain.PairObservation;
import com.stableledger.domain.PairObservationRepository;
import com.stableledger.domain.UnitOfAccountState;
import com.stableledger.domain.UnitOfAccountStateRepository;
import org.bson.Document;
import org.bson.types.Decimal128;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataMongoTest
@Testcontainers(disabledWithoutDocker = true)
@Import(MongoConfig.class)
class LedgerDocumentMongoIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    MongoTemplate mongoTemplate;
    @Autowired
    CollateralPositionRepository positionRepository;
    @Autowired
    PairObservationRepository observationRepository;
    @Autowired
    UnitOfAccountStateRepository unitOfAccountRepository;

    @Test
    @DisplayName("position amounts are stored as Decimal128 without losing 18-decimal precision")
    void positionRoundTripsAsDecimal128() {
        positionRepository.deleteAll();
        CollateralPosition position = CollateralPosition.empty()
                .afterMint(new BigDecimal("1.23456789"), new BigDecimal("61728.394500000000000001"),
                        Instant.parse("2024-05-01T00:00:00Z"));
        positionRepository.save(position);

        Document raw = mongoTemplate.getCollection("collateral_positions").find().first();
        assertThat(raw).isNotNull();
        assertThat(raw.get("totalStableSupplyTracked")).isInstanceOf(Decimal128.class);

        CollateralPosition loaded = positionRepository.findById(CollateralPosition.GLOBAL_ID).orElseThrow();
        assertThat(loaded.getTotalReserveUnits()).isEqualByComparingTo("1.23456789");
        assertThat(loaded.getTotalStableSupplyTracked()).isEqualByComparingTo("61728.394500000000000001");
        assertThat(loaded.getVersion()).isZero();
    }

    @Test
    @DisplayName("stale position write is rejected by the version check")
    void stalePositionWriteRejected() {
        positionRepository.deleteAll();
        CollateralPosition saved = positionRepository.save(CollateralPosition.empty());
        Instant now = Instant.parse("2024-05-01T00:00:00Z");

        positionRepository.save(saved.afterMint(BigDecimal.ONE, new BigDecimal("50000"), now));

        assertThatThrownBy(() -> positionRepository.save(saved.afterMint(BigDecimal.TEN, new BigDecimal("500000"), now)))
                .isInstanceOf(OptimisticLockingFailureException.class);
    }

    @Test
    @DisplayName("observation slots keep accumulators wider than 64 bits")
    void observationRoundTrip() {
        BigInteger wide = BigInteger.ONE.shiftLeft(200).add(BigInteger.valueOf(12345));
        PairObservation observation = new PairObservation("RESERVE-USD", new PairObservation.Observation(1_000L, wide));
        observation.shift(new PairObservation.Observation(2_800L, wide.shiftLeft(1)));
        observationRepository.save(observation);

        PairObservation loaded = observationRepository.findById("RESERVE-USD").orElseThrow();
        assertThat(loaded.getOlder()).isEqualTo(new PairObservation.Observation(1_000L, wide));
        assertThat(loaded.getNewer().accumulator()).isEqualTo(wide.shiftLeft(1));
    }

    @Test
    @DisplayName("unit-of-account base and updates survive a reload")
    void unitOfAccountRoundTrip() {
        UnitOfAccountState state = new UnitOfAccountState(new BigDecimal("120"));
        state.getUpdates().add(new UnitOfAccountState.Update(Instant.parse("2024-05-01T00:00:00Z"),
                new BigDecimal("1.05"), new BigDecimal("126")));
        unitOfAccountRepository.save(state);

        UnitOfAccountState loaded = unitOfAccountRepository.findById(UnitOfAccountState.GLOBAL_ID).orElseThrow();
        assertThat(loaded.getPceBase()).isEqualByComparingTo("120");
        assertThat(loaded.getUpdates()).singleElement()
                .satisfies(u -> assertThat(u.value()).isEqualByComparingTo("1.05"));
    }
}
