package com.positionkeeper.reconciliation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrphanCleanupResult {

    private String scope;
    private int ordersChecked;

    @Builder.Default
    private List<String> cancelledOrderIds = new ArrayList<>();

    /** orderId -> failure reason. */
    @Builder.Default
    private Map<String, String> failedOrderIds = new LinkedHashMap<>();
}
