package com.jay.stfunnel.model.enums;

public enum GuidanceChange {
    RAISED,
    LOWERED,
    NONE
}
