package com.mirrortrader.domain.enums;

/** How a fill changed the position in its market. */
public enum PositionImpact {
    OPENED,
    INCREASED,
    REDUCED,
    CLOSED,
    FLIPPED
}
