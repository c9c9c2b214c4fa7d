package com.positionkeeper.api.dto.request;

import com.positionkeeper.domain.enums.Direction;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for opening a managed position.
 * Price ordering per direction is checked by the engine, not here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OpenPositionRequest {

    @NotBlank
    private String symbol;

    @NotNull
    private Direction direction;

    /** Total contracts, split into tp1, tp2 and the runner. */
    @NotNull
    @Positive
    private Integer size;

    /** Reference entry price; the actual entry is the market fill price when reported. */
    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal entryPrice;

    @NotNull
    @Positive
    private Integer tp1Size;

    @NotNull
    @Positive
    private Integer tp2Size;

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal tp1Price;

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal tp2Price;

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal stopPrice;

    @NotBlank
    private String credentialId;

    /** Settlement market, e.g. "usdt". */
    @NotBlank
    private String market;
}
