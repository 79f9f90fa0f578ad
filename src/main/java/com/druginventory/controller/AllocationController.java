package com.druginventory.controller;

import com.druginventory.config.RequestIdFilter;
import com.druginventory.dto.AllocationResponse;
import com.druginventory.dto.BatchAllocationRequest;
import com.druginventory.dto.FefoAllocationRequest;
import com.druginventory.dto.GroupingRequest;
import com.druginventory.model.BatchAllocation;
import com.druginventory.model.DrugGroup;
import com.druginventory.service.DrugGroupingService;
import com.druginventory.service.FefoAllocationService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AllocationController {

    private final DrugGroupingService groupingService;
    private final FefoAllocationService allocationService;

    @PostMapping("/inventory/groups")
    public ResponseEntity<List<DrugGroup>> groups(@Valid @RequestBody GroupingRequest request) {
        return ResponseEntity.ok(groupingService.groupByDrug(request.getBatches()));
    }

    @PostMapping("/allocations/fefo")
    public ResponseEntity<AllocationResponse> allocateFefo(
            @Valid @RequestBody FefoAllocationRequest request, HttpServletRequest httpRequest) {
        List<BatchAllocation> allocations = allocationService.allocateFefo(
            request.getBatches(), request.profile(), request.getQuantity());
        log.info("POST /allocations/fefo | profile={} | requested={} | batches={} | requestId={}",
            request.profile().key(), request.getQuantity(), allocations.size(),
            RequestIdFilter.requestIdOf(httpRequest));
        return ResponseEntity.ok(AllocationResponse.of(request.getQuantity(), allocations));
    }

    @PostMapping("/allocations/batch")
    public ResponseEntity<AllocationResponse> allocateBatch(
            @Valid @RequestBody BatchAllocationRequest request, HttpServletRequest httpRequest) {
        BatchAllocation allocation = allocationService.allocateSpecificBatch(
            request.getBatches(), request.getBatchId(), request.getQuantity());
        log.info("POST /allocations/batch | batchId={} | requested={} | requestId={}",
            request.getBatchId(), request.getQuantity(), RequestIdFilter.requestIdOf(httpRequest));
        return ResponseEntity.ok(AllocationResponse.of(request.getQuantity(), List.of(allocation)));
    }
}
