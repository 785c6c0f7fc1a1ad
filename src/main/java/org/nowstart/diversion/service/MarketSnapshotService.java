package org.nowstart.diversion.service;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.nowstart.diversion.data.dto.MarketSnapshot;
import org.nowstart.diversion.data.dto.TradeRequest;
import org.nowstart.diversion.data.property.MarketProperties;
import org.springframework.stereotype.Service;

/**
 * Offline proxy snapshot built from configuration. A licensed price feed can replace it without
 * touching the calculation services.
 */
@Service
@RequiredArgsConstructor
public class MarketSnapshotService {

    static final String PROXY = "proxy";

    private final MarketProperties marketProperties;

    public MarketSnapshot snapshot(String asOf) {
        double priceA = marketProperties.priceAUsdMmbtu().doubleValue();
        double priceB = marketProperties.priceBUsdMmbtu() != null
                ? marketProperties.priceBUsdMmbtu().doubleValue()
                : priceA + marketProperties.priceBPremiumUsdMmbtu().doubleValue();
        double freight = marketProperties.freightUsdDay().doubleValue()
                * marketProperties.freightRegimeMultiplier().doubleValue();

        Map<String, String> provenance = new LinkedHashMap<>();
        provenance.put("PRICE_A", PROXY);
        provenance.put("PRICE_B", PROXY);
        provenance.put("FREIGHT", PROXY);
        provenance.put("FUEL", PROXY);
        provenance.put("EUA", PROXY);

        return new MarketSnapshot(
                asOf == null || asOf.isBlank() ? "latest" : asOf,
                priceA,
                priceB,
                freight,
                marketProperties.fuelUsdPerT().doubleValue(),
                marketProperties.euaUsdPerTco2().doubleValue(),
                provenance
        );
    }

    public TradeRequest defaultRequest(MarketSnapshot snapshot) {
        return new TradeRequest(
                marketProperties.loadPort(),
                marketProperties.marketAPort(),
                marketProperties.marketBPort(),
                marketProperties.vesselClass(),
                marketProperties.cargoCapacityM3().doubleValue(),
                snapshot.priceAUsdMmbtu(),
                snapshot.priceBUsdMmbtu(),
                snapshot.freightRateUsdDay(),
                snapshot.fuelPriceUsdT(),
                snapshot.euaPriceUsdT(),
                marketProperties.fuelType()
        );
    }
}
