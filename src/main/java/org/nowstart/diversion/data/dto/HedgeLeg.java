package org.nowstart.diversion.data.dto;

import org.nowstart.diversion.data.type.HedgeSide;

public record HedgeLeg(
        HedgeSide side,
        String instrument,
        int lots
) {

    public String label() {
        return side + " " + instrument;
    }
}
