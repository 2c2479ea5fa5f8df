package com.tracker.core.exchange;

import com.tracker.core.model.Position;

import java.util.List;

/**
 * Read-only view of the venue the tracker polls.
 * Implementations normalize venue payloads into {@link Position} and bound every call with a timeout.
 */
public interface ExchangeGateway {

    /**
     * Human-readable venue name used in announcements and status output.
     */
    String name();

    /**
     * All currently open positions. Implementations may include zero-size entries;
     * the snapshot builder drops them.
     */
    List<Position> fetchPositions() throws FetchException;

    /**
     * Latest traded price for the symbol.
     */
    double fetchReferencePrice(String symbol) throws FetchException;
}
