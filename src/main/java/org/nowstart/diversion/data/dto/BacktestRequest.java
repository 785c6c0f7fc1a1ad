package org.nowstart.diversion.data.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record BacktestRequest(
        // prices on the voyage are replaced row by row from history
        @NotNull(message = "voyage is required")
        @Valid
        TradeRequest voyage,
        @NotEmpty(message = "history must not be empty")
        List<@Valid MarketObservation> history
) {
}
