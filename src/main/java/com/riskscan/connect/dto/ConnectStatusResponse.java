package com.riskscan.connect.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Non-secret view of the OAuth client setup.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConnectStatusResponse {
    private boolean clientKeyConfigured;
    private String redirectUri;
    private String scopes;
    private int pendingSessions;
    private Long identityId; // from the session cookie, null when not connected
}
