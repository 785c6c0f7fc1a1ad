package org.nowstart.diversion.data.dto;

public record NetbackComparison(
        NetbackResult marketA,
        NetbackResult marketB
) {
}
