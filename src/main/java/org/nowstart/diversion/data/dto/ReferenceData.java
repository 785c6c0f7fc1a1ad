package org.nowstart.diversion.data.dto;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.nowstart.diversion.data.exception.InvalidConfigException;
import org.nowstart.diversion.data.exception.ReferenceDataNotFoundException;

/**
 * Read-only route table, vessel table and carbon parameters shared by every evaluation.
 */
public record ReferenceData(
        List<Route> routes,
        List<Vessel> vessels,
        CarbonParams carbonParams
) {

    public ReferenceData {
        routes = routes == null ? List.of() : List.copyOf(routes);
        vessels = vessels == null ? List.of() : List.copyOf(vessels);
        if (carbonParams == null) {
            throw new InvalidConfigException("carbonParams is required");
        }

        Set<String> routeKeys = new HashSet<>();
        for (Route route : routes) {
            if (!routeKeys.add(route.loadPort() + "->" + route.dischargePort())) {
                throw new InvalidConfigException("Duplicate route: " + route.loadPort() + "->" + route.dischargePort());
            }
        }
        Set<String> vesselClasses = new HashSet<>();
        for (Vessel vessel : vessels) {
            if (!vesselClasses.add(vessel.vesselClass())) {
                throw new InvalidConfigException("Duplicate vessel class: " + vessel.vesselClass());
            }
        }
    }

    public Route route(String loadPort, String dischargePort) {
        return routes.stream()
                .filter(route -> route.connects(loadPort, dischargePort))
                .findFirst()
                .orElseThrow(() -> ReferenceDataNotFoundException.route(loadPort, dischargePort));
    }

    public Vessel vessel(String vesselClass) {
        return vessels.stream()
                .filter(vessel -> vessel.vesselClass().equals(vesselClass))
                .findFirst()
                .orElseThrow(() -> ReferenceDataNotFoundException.vessel(vesselClass));
    }
}
