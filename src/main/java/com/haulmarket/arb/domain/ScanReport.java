package com.haulmarket.arb.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Value
@Builder
public class ScanReport {
    Instant startedAt;
    Duration elapsed;
    List<Opportunity> opportunities;
    @Singular
    List<Route> succeededRoutes;
    @Singular
    List<RouteFailure> failures;
    @Singular
    List<Route> skippedRoutes;

    public int getAttemptedCount() {
        return succeededRoutes.size() + failures.size();
    }

    public int getSucceededCount() {
        return succeededRoutes.size();
    }

    public int getFailedCount() {
        return failures.size();
    }

    public List<String> summaryLines() {
        List<String> lines = new ArrayList<>();
        lines.add(String.format("Scan finished in %d ms: %d routes attempted, %d succeeded, %d failed, %d skipped, %d opportunities",
                elapsed.toMillis(), getAttemptedCount(), getSucceededCount(), getFailedCount(),
                skippedRoutes.size(), opportunities.size()));
        for (RouteFailure failure : failures) {
            lines.add("  FAILED " + failure.summaryLine());
        }
        return lines;
    }
}
