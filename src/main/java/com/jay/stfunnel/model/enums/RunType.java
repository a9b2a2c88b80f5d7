package com.jay.stfunnel.model.enums;

public enum RunType {
    CONSTRUCTION,
    MONTHLY_REVIEW
}
