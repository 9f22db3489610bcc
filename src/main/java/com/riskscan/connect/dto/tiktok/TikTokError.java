package com.riskscan.connect.dto.tiktok;

import com.google.api.client.json.GenericJson;
import com.google.api.client.util.Key;

/**
 * Error envelope returned by the TikTok v2 APIs; {@code code} is "ok" on success.
 */
public class TikTokError extends GenericJson {

    @Key
    private String code;

    @Key
    private String message;

    @Key("log_id")
    private String logId;

    public boolean isOk() {
        return code == null || code.isBlank() || "ok".equalsIgnoreCase(code);
    }

    public String getCode() { return code; }
    public String getMessage() { return message; }
    public String getLogId() { return logId; }
}
