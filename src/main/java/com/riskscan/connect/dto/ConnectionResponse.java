package com.riskscan.connect.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.riskscan.connect.entity.Identity;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionResponse {
    private String message;
    private Long identityId;
    private String externalId;
    private String displayName;
    private String avatarUrl;
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime expiresAt;

    public static ConnectionResponse connected(Identity identity) {
        return new ConnectionResponse("Account connected", identity.getId(), identity.getExternalId(),
                identity.getDisplayName(), identity.getAvatarUrl(), identity.getExpiresAt());
    }
}
