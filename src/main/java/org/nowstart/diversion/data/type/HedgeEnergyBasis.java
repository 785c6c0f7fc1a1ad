package org.nowstart.diversion.data.type;

/**
 * Which delivered energy the hedge volume is derived from, before the coverage ratio is applied.
 */
public enum HedgeEnergyBasis {
    // delivered energy of the destination with the higher netback
    STRONGER_NETBACK,
    // larger delivered energy of the two destinations
    MAX_DELIVERED
}
