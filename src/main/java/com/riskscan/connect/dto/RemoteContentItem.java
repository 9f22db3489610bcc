package com.riskscan.connect.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A post as returned by the remote list call, before validation. Any field may be missing.
 * Entries the client could not convert carry {@code malformed = true} and at most the raw id.
 */
@Data
@NoArgsConstructor
public class RemoteContentItem {
    private String externalItemId;
    private String caption;
    private String coverUrl;
    private LocalDateTime createdAt;
    private String shareUrl;
    private boolean malformed;

    public RemoteContentItem(String externalItemId, String caption, String coverUrl,
                             LocalDateTime createdAt, String shareUrl) {
        this.externalItemId = externalItemId;
        this.caption = caption;
        this.coverUrl = coverUrl;
        this.createdAt = createdAt;
        this.shareUrl = shareUrl;
    }

    public static RemoteContentItem malformed(String externalItemId) {
        RemoteContentItem item = new RemoteContentItem();
        item.setExternalItemId(externalItemId);
        item.setMalformed(true);
        return item;
    }
}
