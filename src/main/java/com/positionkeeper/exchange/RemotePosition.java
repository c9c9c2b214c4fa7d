package com.positionkeeper.exchange;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RemotePosition {

    private String symbol;

    /** Signed contracts: positive = long, negative = short, 0 = flat. */
    private int size;
}
