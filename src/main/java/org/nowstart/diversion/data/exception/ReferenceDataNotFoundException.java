package org.nowstart.diversion.data.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class ReferenceDataNotFoundException extends DiversionException {

    private final String key;

    private ReferenceDataNotFoundException(String key, String message) {
        super(HttpStatus.NOT_FOUND, "reference_not_found", message);
        this.key = key;
    }

    public static ReferenceDataNotFoundException route(String loadPort, String dischargePort) {
        String key = loadPort + "->" + dischargePort;
        return new ReferenceDataNotFoundException(key, "Route not found: " + key);
    }

    public static ReferenceDataNotFoundException vessel(String vesselClass) {
        return new ReferenceDataNotFoundException(vesselClass, "Vessel class not found: " + vesselClass);
    }
}
