package com.tradescan.backend.model;

/**
 * Live states of a position row. A fully closed position leaves the table and becomes a {@link ClosedPosition}.
 */
public enum PositionState {
    OPEN,
    CLOSING
}
