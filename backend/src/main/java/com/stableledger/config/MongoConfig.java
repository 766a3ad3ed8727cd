package com.stableledger.config;

import org.bson.types.Decimal128;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import java.math.BigDecimal;
import java.util.List;

/**
 * Ledger amounts (positions, unit-of-account values) are stored as Decimal128. Observation accumulators
 * are BigInteger and go through the default mapping as strings.
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoCustomConversions customConversions() {
        return new MongoCustomConversions(List.of(new AmountWriter(), new AmountReader()));
    }

    /** Amounts carry at most 18 decimals, well inside Decimal128's 34 significant digits. */
    @WritingConverter
    static class AmountWriter implements Converter<BigDecimal, Decimal128> {

        @Override
        public Decimal128 convert(BigDecimal source) {
            return new Decimal128(source);
        }
    }

    /** Negative zero reads as zero; NaN and infinities are not amounts and fail the read. */
    @ReadingConverter
    static class AmountReader implements Converter<Decimal128, BigDecimal> {

        @Override
        public BigDecimal convert(Decimal128 source) {
            if (source.isNaN() || source.isInfinite()) {
                throw new IllegalStateException("Stored amount is not a number: " + source);
            }
            // bigDecimalValue() throws on negative zero
            return source.isNegative() ? new BigDecimal(source.toString()) : source.bigDecimalValue();
        }
    }
}
