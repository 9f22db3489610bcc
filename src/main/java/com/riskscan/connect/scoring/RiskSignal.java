package com.riskscan.connect.scoring;

/**
 * Signal classes extracted from a caption. Declaration order is the order tags are reported in.
 */
public enum RiskSignal {
    POSSIBLE_LOCATION("possible_location"),
    CONTACT_INFO("contact_info"),
    SCHEDULE_TIME("schedule_time"),
    WORKPLACE("workplace");

    private final String tag;

    RiskSignal(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
