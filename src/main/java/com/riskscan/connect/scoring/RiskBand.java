package com.riskscan.connect.scoring;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskBand {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}
