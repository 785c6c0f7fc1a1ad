package org.nowstart.diversion.data.type;

public enum FuelType {
    VLSFO,
    LNG
}
