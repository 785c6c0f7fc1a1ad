package org.nowstart.diversion.data.dto;

import java.util.List;

public record TradePack(
        TradeRequest inputs,
        DecisionParams params,
        NetbackResult marketA,
        NetbackResult marketB,
        DecisionResult decision,
        List<HedgeLeg> hedgeLegs
) {

    public TradePack {
        hedgeLegs = hedgeLegs == null ? List.of() : List.copyOf(hedgeLegs);
    }
}
