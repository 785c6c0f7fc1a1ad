package org.nowstart.diversion.data.property;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import org.nowstart.diversion.data.dto.CarbonParams;
import org.nowstart.diversion.data.dto.ReferenceData;
import org.nowstart.diversion.data.dto.Route;
import org.nowstart.diversion.data.dto.Vessel;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "diversion.reference")
public record ReferenceDataProperties(
        @NotEmpty List<Route> routes,
        @NotEmpty List<Vessel> vessels,
        @NotNull CarbonParams carbon
) {

    public ReferenceData toReferenceData() {
        return new ReferenceData(routes, vessels, carbon);
    }
}
