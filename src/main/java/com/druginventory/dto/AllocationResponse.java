package com.druginventory.dto;

import com.druginventory.model.BatchAllocation;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AllocationResponse {
    int requestedQuantity;
    int allocatedQuantity;
    int batchCount;
    List<BatchAllocation> allocations;

    public static AllocationResponse of(int requested, List<BatchAllocation> allocations) {
        return AllocationResponse.builder()
            .requestedQuantity(requested)
            .allocatedQuantity(allocations.stream().mapToInt(BatchAllocation::getQuantity).sum())
            .batchCount(allocations.size())
            .allocations(allocations)
            .build();
    }
}
