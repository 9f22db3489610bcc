package com.riskscan.connect.security;

import com.riskscan.connect.entity.Identity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;

class JwtTokenProviderTest {

    private JwtTokenProvider tokenProvider;

    @BeforeEach
    void setUp() {
        tokenProvider = new JwtTokenProvider();
        ReflectionTestUtils.setField(tokenProvider, "jwtSecret", "01234567890123456789012345678901");
        ReflectionTestUtils.setField(tokenProvider, "jwtExpiration", 3_600_000L);
    }

    @Test
    void tokenCarriesIdentityId() {
        Identity identity = new Identity();
        identity.setId(42L);
        identity.setExternalId("open-42");
        identity.setDisplayName("Casey");

        String token = tokenProvider.generateToken(identity);

        assertThat(tokenProvider.validateToken(token)).isTrue();
        assertThat(tokenProvider.getIdentityIdFromToken(token)).isEqualTo(42L);
        assertThat(tokenProvider.getAllClaimsFromToken(token).get("externalId", String.class)).isEqualTo("open-42");
    }

    @Test
    void tamperedTokenIsRejected() {
        Identity identity = new Identity();
        identity.setId(7L);
        identity.setExternalId("open-7");
        String token = tokenProvider.generateToken(identity);
        String[] parts = token.split("\\.");
        String forgedPayload = Base64.getUrlEncoder().withoutPadding()
                .encodeToString("{\"sub\":\"999\"}".getBytes(StandardCharsets.UTF_8));
        String tampered = parts[0] + "." + forgedPayload + "." + parts[2];

        assertThat(tokenProvider.validateToken(tampered)).isFalse();
        assertThat(tokenProvider.validateToken("not-a-token")).isFalse();
    }

    @Test
    void tokenSignedWithAnotherSecretIsRejected() {
        Identity identity = new Identity();
        identity.setId(7L);
        identity.setExternalId("open-7");
        JwtTokenProvider other = new JwtTokenProvider();
        ReflectionTestUtils.setField(other, "jwtSecret", "abcdefghijklmnopqrstuvwxyz012345");
        ReflectionTestUtils.setField(other, "jwtExpiration", 3_600_000L);

        assertThat(tokenProvider.validateToken(other.generateToken(identity))).isFalse();
    }
}
