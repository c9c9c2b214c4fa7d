package com.positionkeeper.oms;

import com.positionkeeper.domain.enums.Direction;
import com.positionkeeper.domain.model.LifecycleSettings;
import com.positionkeeper.exchange.ConditionalOrderSpec;
import com.positionkeeper.exchange.MarketOrderSpec;
import com.positionkeeper.exchange.TriggerRule;
import java.math.BigDecimal;
import org.springframework.stereotype.Component;

/**
 * Builds the exchange order specs for entries and protective orders.
 *
 * <p>Stops trigger on the losing side ({@code <=} for long, {@code >=} for short) and close
 * whatever is open. Take-profits trigger on the winning side and close their tier size.
 * Everything protective is reduce-only so a stale order can never add exposure.
 */
@Component
public class ProtectiveOrderFactory {

    public static final String LABEL_TP1 = "TP1";
    public static final String LABEL_TP2 = "TP2";
    public static final String LABEL_STOP = "SL";
    public static final String LABEL_EMERGENCY_STOP = "EMERGENCY_SL";

    private final LifecycleSettings lifecycleSettings;
    private final StopPriceCalculator stopPriceCalculator;

    public ProtectiveOrderFactory(LifecycleSettings lifecycleSettings, StopPriceCalculator stopPriceCalculator) {
        this.lifecycleSettings = lifecycleSettings;
        this.stopPriceCalculator = stopPriceCalculator;
    }

    public MarketOrderSpec entry(String symbol, Direction direction, int size) {
        return MarketOrderSpec.builder()
                .symbol(symbol)
                .direction(direction)
                .size(size)
                .reduceOnly(false)
                .build();
    }

    /** Reduce-only market order that closes {@code size} of a position. */
    public MarketOrderSpec flatten(String symbol, Direction positionDirection, int size) {
        return MarketOrderSpec.builder()
                .symbol(symbol)
                .direction(positionDirection == Direction.LONG ? Direction.SHORT : Direction.LONG)
                .size(size)
                .reduceOnly(true)
                .build();
    }

    public ConditionalOrderSpec takeProfit(
            String symbol, Direction direction, BigDecimal price, int size, String label) {
        return ConditionalOrderSpec.builder()
                .symbol(symbol)
                .positionDirection(direction)
                .triggerPrice(stopPriceCalculator.roundToTick(price))
                .triggerRule(direction == Direction.LONG ? TriggerRule.GREATER_OR_EQUAL : TriggerRule.LESS_OR_EQUAL)
                .size(size)
                .closeAll(false)
                .reduceOnly(true)
                .expirationSeconds(lifecycleSettings.getOrderExpirySeconds())
                .label(label)
                .build();
    }

    public ConditionalOrderSpec stop(String symbol, Direction direction, BigDecimal price, String label) {
        return ConditionalOrderSpec.builder()
                .symbol(symbol)
                .positionDirection(direction)
                .triggerPrice(stopPriceCalculator.roundToTick(price))
                .triggerRule(direction == Direction.LONG ? TriggerRule.LESS_OR_EQUAL : TriggerRule.GREATER_OR_EQUAL)
                .size(0)
                .closeAll(true)
                .reduceOnly(true)
                .expirationSeconds(lifecycleSettings.getOrderExpirySeconds())
                .label(label)
                .build();
    }
}
