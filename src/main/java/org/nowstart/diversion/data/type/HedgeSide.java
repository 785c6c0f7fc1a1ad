package org.nowstart.diversion.data.type;

public enum HedgeSide {
    BUY,
    SELL
}
