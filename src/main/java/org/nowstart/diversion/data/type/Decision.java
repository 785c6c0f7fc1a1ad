package org.nowstart.diversion.data.type;

public enum Decision {
    DIVERT,
    KEEP
}
