package com.yieldoracle.schedule;

import com.yieldoracle.service.PublishException;
import com.yieldoracle.service.YieldCycleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Fires a yield cycle at a fixed rate, first run right after startup.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class YieldCycleScheduler {

    private final YieldCycleService cycleService;

    @Scheduled(
            fixedRateString = "${app.polling.interval:PT10M}",
            initialDelayString = "${app.polling.initial-delay:PT0S}")
    public void run() {
        log.info("[yield-scheduler] tick {}", System.currentTimeMillis());
        try {
            cycleService.runCycle();
        } catch (PublishException e) {
            log.error("[yield-scheduler] cycle failed, previous snapshot stays in place: {}", e.getMessage(), e);
        }
    }
}
