package com.riskscan.connect.dto.tiktok;

import com.google.api.client.json.GenericJson;
import com.google.api.client.util.Key;

public class TokenResponse extends GenericJson {

    @Key("access_token")
    private String accessToken;

    @Key("refresh_token")
    private String refreshToken;

    @Key("expires_in")
    private Long expiresIn;

    @Key("open_id")
    private String openId;

    @Key
    private String scope;

    // Set instead of the token fields when the grant is rejected
    @Key
    private String error;

    @Key("error_description")
    private String errorDescription;

    public String getAccessToken() { return accessToken; }
    public String getRefreshToken() { return refreshToken; }
    public Long getExpiresIn() { return expiresIn; }
    public String getOpenId() { return openId; }
    public String getScope() { return scope; }
    public String getError() { return error; }
    public String getErrorDescription() { return errorDescription; }
}
