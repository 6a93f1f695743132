package com.yieldoracle.api;

import com.yieldoracle.model.AggregateMetrics;
import com.yieldoracle.model.YieldSample;
import com.yieldoracle.service.LatestYield;
import com.yieldoracle.service.ProtocolStatus;
import com.yieldoracle.service.YieldCycleService;
import com.yieldoracle.service.YieldQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Read endpoints over the latest aggregate and per-protocol history, plus a manual cycle trigger.
 */
@RestController
@RequestMapping("/api/v1/yield")
@RequiredArgsConstructor
public class YieldController {

    private final YieldQueryService queryService;
    private final YieldCycleService cycleService;

    /** Latest aggregate and samples; 204 before the first stored cycle. */
    @GetMapping("/latest")
    public ResponseEntity<LatestYield> latest() {
        return queryService.getLatest()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/protocols")
    public List<ProtocolStatus> protocols() {
        return queryService.protocols();
    }

    @GetMapping("/protocols/{protocolId}/latest")
    public ResponseEntity<YieldSample> protocolLatest(@PathVariable String protocolId) {
        return queryService.getProtocolLatest(protocolId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    /**
     * Samples of a protocol over the last {@code hours}, oldest first.
     */
    @GetMapping("/protocols/{protocolId}/history")
    public List<YieldSample> history(
            @PathVariable String protocolId,
            @RequestParam(defaultValue = "24") int hours
    ) {
        return queryService.getProtocolHistory(protocolId, hours);
    }

    @PostMapping("/cycle")
    public AggregateMetrics runCycle() {
        return cycleService.runCycle();
    }
}
