package com.haulmarket.arb.core;

import com.haulmarket.arb.domain.Route;

/**
 * A route's results could not be committed. Aborts the scan that produced them.
 */
public class ScanPersistenceException extends ResultStoreException {

    private final Route route;

    public ScanPersistenceException(Route route, Throwable cause) {
        super("Failed to persist results for " + route, cause);
        this.route = route;
    }

    public Route getRoute() {
        return route;
    }
}
