package com.riskscan.connect.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * Credentials granted by the provider. {@code expiresAt} is computed locally when the grant is received.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TokenSet {
    @ToString.Exclude
    private String accessToken;
    @ToString.Exclude
    private String refreshToken;
    private LocalDateTime expiresAt;
    private String openId; // optional, some grants include it
    private String scope;
}
