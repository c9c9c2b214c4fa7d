package com.positionkeeper.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;

import com.positionkeeper.domain.enums.Direction;
import com.positionkeeper.domain.model.LifecycleSettings;
import com.positionkeeper.oms.StopPriceCalculator;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class StopPriceCalculatorTest {

    private StopPriceCalculator stopPriceCalculator;

    @BeforeEach
    void setUp() {
        stopPriceCalculator = new StopPriceCalculator(LifecycleSettings.builder().build());
    }

    @Nested
    @DisplayName("Break-even")
    class BreakEven {

        @Test
        @DisplayName("Long: entry plus 5 bps")
        void longBreakEven() {
            assertThat(stopPriceCalculator.breakEven(new BigDecimal("50000"), Direction.LONG))
                    .isEqualByComparingTo("50025");
        }

        @Test
        @DisplayName("Short: entry minus 5 bps")
        void shortBreakEven() {
            assertThat(stopPriceCalculator.breakEven(new BigDecimal("50000"), Direction.SHORT))
                    .isEqualByComparingTo("49975");
        }

        @Test
        @DisplayName("Result is rounded to the tick size")
        void roundedToTick() {
            // 1234.56 * 1.0005 = 1235.17728
            assertThat(stopPriceCalculator.breakEven(new BigDecimal("1234.56"), Direction.LONG))
                    .isEqualByComparingTo("1235.2");
        }
    }

    @Nested
    @DisplayName("Trailing")
    class Trailing {

        @Test
        @DisplayName("Long trails 1% below the fill")
        void longTrails() {
            assertThat(stopPriceCalculator.trailing(new BigDecimal("51500"), Direction.LONG, new BigDecimal("50025")))
                    .isEqualByComparingTo("50985");
        }

        @Test
        @DisplayName("Short trails 1% above the fill")
        void shortTrails() {
            assertThat(stopPriceCalculator.trailing(new BigDecimal("48500"), Direction.SHORT, new BigDecimal("49975")))
                    .isEqualByComparingTo("48985");
        }

        @Test
        @DisplayName("Never loosens an existing long stop")
        void neverLoosensLong() {
            assertThat(stopPriceCalculator.trailing(new BigDecimal("50100"), Direction.LONG, new BigDecimal("50025")))
                    .isEqualByComparingTo("50025");
        }

        @Test
        @DisplayName("Never loosens an existing short stop")
        void neverLoosensShort() {
            assertThat(stopPriceCalculator.trailing(new BigDecimal("49900"), Direction.SHORT, new BigDecimal("49975")))
                    .isEqualByComparingTo("49975");
        }

        @Test
        @DisplayName("Without a current stop the candidate is used as is")
        void noCurrentStop() {
            assertThat(stopPriceCalculator.trailing(new BigDecimal("51500"), Direction.LONG, null))
                    .isEqualByComparingTo("50985");
        }
    }

    @Test
    @DisplayName("Zero tick size leaves prices unrounded")
    void zeroTickSize() {
        StopPriceCalculator unrounded = new StopPriceCalculator(
                LifecycleSettings.builder().tickSize(BigDecimal.ZERO).build());

        assertThat(unrounded.roundToTick(new BigDecimal("123.456"))).isEqualByComparingTo("123.456");
    }
}
