package com.positionkeeper.api.dto.request;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a fill made outside the managed orders.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManualFillRequest {

    @NotNull
    @Positive
    private Integer size;

    /** Fill price; PnL is not accrued when absent. */
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal price;
}
