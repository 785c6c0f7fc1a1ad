package org.nowstart.diversion.data.property;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import org.nowstart.diversion.data.type.FuelType;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "diversion.market")
public record MarketProperties(
        // market A benchmark (TTF) in USD/MMBtu
        @NotNull @DecimalMin("0") @DefaultValue("35.69") BigDecimal priceAUsdMmbtu,
        // explicit market B price; when absent, price A plus premium is used
        BigDecimal priceBUsdMmbtu,
        @NotNull @DefaultValue("2.75") BigDecimal priceBPremiumUsdMmbtu,
        @NotNull @DecimalMin("0") @DefaultValue("85000") BigDecimal freightUsdDay,
        @NotNull @DecimalMin("0") @DefaultValue("1.0") BigDecimal freightRegimeMultiplier,
        @NotNull @DecimalMin("0") @DefaultValue("583") BigDecimal fuelUsdPerT,
        @NotNull @DecimalMin("0") @DefaultValue("74.40") BigDecimal euaUsdPerTco2,
        // default voyage evaluated against the snapshot
        @NotBlank @DefaultValue("US_Gulf") String loadPort,
        @NotBlank @DefaultValue("Rotterdam") String marketAPort,
        @NotBlank @DefaultValue("Tokyo") String marketBPort,
        @NotBlank @DefaultValue("TFDE") String vesselClass,
        @NotNull @DecimalMin(value = "0", inclusive = false) @DefaultValue("174000") BigDecimal cargoCapacityM3,
        @NotNull @DefaultValue("VLSFO") FuelType fuelType
) {
}
