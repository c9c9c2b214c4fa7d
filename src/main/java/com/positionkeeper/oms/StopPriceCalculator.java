package com.positionkeeper.oms;

import com.positionkeeper.domain.enums.Direction;
import com.positionkeeper.domain.model.LifecycleSettings;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.stereotype.Component;

/**
 * Stop levels used when a take-profit tier fills.
 *
 * <p>Break-even after tp1: {@code entry * (1 + buffer)} for long, {@code entry * (1 - buffer)}
 * for short. Trailing after tp2: {@code fill * (1 - distance)} for long, {@code fill * (1 + distance)}
 * for short, never looser than the stop already in place. All results are rounded to the tick size.
 */
@Component
public class StopPriceCalculator {

    private final LifecycleSettings lifecycleSettings;

    public StopPriceCalculator(LifecycleSettings lifecycleSettings) {
        this.lifecycleSettings = lifecycleSettings;
    }

    public BigDecimal breakEven(BigDecimal entryPrice, Direction direction) {
        BigDecimal factor = direction == Direction.LONG
                ? BigDecimal.ONE.add(lifecycleSettings.getBreakEvenBuffer())
                : BigDecimal.ONE.subtract(lifecycleSettings.getBreakEvenBuffer());
        return roundToTick(entryPrice.multiply(factor));
    }

    public BigDecimal trailing(BigDecimal fillPrice, Direction direction, BigDecimal currentStop) {
        BigDecimal factor = direction == Direction.LONG
                ? BigDecimal.ONE.subtract(lifecycleSettings.getTrailingDistance())
                : BigDecimal.ONE.add(lifecycleSettings.getTrailingDistance());
        BigDecimal candidate = roundToTick(fillPrice.multiply(factor));
        if (currentStop == null) {
            return candidate;
        }
        return direction == Direction.LONG ? candidate.max(currentStop) : candidate.min(currentStop);
    }

    public BigDecimal roundToTick(BigDecimal price) {
        BigDecimal tick = lifecycleSettings.getTickSize();
        if (tick == null || tick.signum() <= 0) {
            return price;
        }
        return price.divide(tick, 0, RoundingMode.HALF_UP).multiply(tick);
    }
}
