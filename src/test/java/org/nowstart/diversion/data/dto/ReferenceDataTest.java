package org.nowstart.diversion.data.dto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.diversion.data.exception.InvalidConfigException;
import org.nowstart.diversion.data.exception.ReferenceDataNotFoundException;
import org.nowstart.diversion.data.type.FuelType;

class ReferenceDataTest {

    private static final CarbonParams CARBON = new CarbonParams(74.40, 3.114, 2.750);

    @Test
    void route_looksUpDirectedPair() {
        ReferenceData referenceData = new ReferenceData(
                List.of(new Route("US_Gulf", "Rotterdam", 5000.0), new Route("US_Gulf", "Tokyo", 9500.0)),
                List.of(tfde()),
                CARBON
        );

        assertThat(referenceData.route("US_Gulf", "Tokyo").distanceNm()).isEqualTo(9500.0);
        assertThatThrownBy(() -> referenceData.route("Tokyo", "US_Gulf"))
                .isInstanceOf(ReferenceDataNotFoundException.class)
                .hasMessage("Route not found: Tokyo->US_Gulf")
                .satisfies(e -> assertThat(((ReferenceDataNotFoundException) e).getKey()).isEqualTo("Tokyo->US_Gulf"));
    }

    @Test
    void vessel_throwsWhenClassUnknown() {
        ReferenceData referenceData = new ReferenceData(List.of(), List.of(tfde()), CARBON);

        assertThat(referenceData.vessel("TFDE").boilOffPctPerDay()).isEqualTo(0.10);
        assertThatThrownBy(() -> referenceData.vessel("MEGI"))
                .isInstanceOf(ReferenceDataNotFoundException.class)
                .hasMessage("Vessel class not found: MEGI");
    }

    @Test
    void constructor_rejectsDuplicates() {
        assertThatThrownBy(() -> new ReferenceData(
                List.of(new Route("US_Gulf", "Tokyo", 9500.0), new Route("US_Gulf", "Tokyo", 9600.0)),
                List.of(tfde()),
                CARBON))
                .isInstanceOf(InvalidConfigException.class)
                .hasMessageContaining("Duplicate route");
        assertThatThrownBy(() -> new ReferenceData(List.of(), List.of(tfde(), tfde()), CARBON))
                .isInstanceOf(InvalidConfigException.class)
                .hasMessageContaining("Duplicate vessel class");
        assertThatThrownBy(() -> new ReferenceData(List.of(), List.of(), null))
                .isInstanceOf(InvalidConfigException.class);
    }

    @Test
    void vesselAndRoute_validateFields() {
        assertThatThrownBy(() -> new Vessel("TFDE", 174_000.0, 0.0, 19.5, 0.10, 130.0, 130.0))
                .isInstanceOf(InvalidConfigException.class)
                .hasMessageContaining("ladenSpeedKn");
        assertThatThrownBy(() -> new Vessel("TFDE", 174_000.0, 19.5, 19.5, 100.0, 130.0, 130.0))
                .isInstanceOf(InvalidConfigException.class)
                .hasMessageContaining("boilOffPctPerDay");
        assertThatThrownBy(() -> new Route("US_Gulf", "Tokyo", -1.0))
                .isInstanceOf(InvalidConfigException.class);
        assertThat(tfde().withCargoCapacity(150_000.0).cargoCapacityM3()).isEqualTo(150_000.0);
    }

    @Test
    void carbonParams_selectsFactorByFuel() {
        assertThat(CARBON.co2Factor(FuelType.VLSFO)).isEqualTo(3.114);
        assertThat(CARBON.co2Factor(FuelType.LNG)).isEqualTo(2.750);
    }

    private static Vessel tfde() {
        return new Vessel("TFDE", 174_000.0, 19.5, 19.5, 0.10, 130.0, 130.0);
    }
}
