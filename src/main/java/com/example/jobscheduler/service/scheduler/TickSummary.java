package com.example.jobscheduler.service.scheduler;

import lombok.Builder;
import lombok.Value;

/**
 * What one tick did, available once every dispatched call has settled
 */
@Value
@Builder
public class TickSummary {

    int dispatched;
    int succeeded;
    int failed;

    /**
     * Entries whose occurrence was missed and got recomputed from now
     */
    int expired;

    /**
     * Jobs deactivated because their schedule ran out
     */
    int retired;
}
