package com.riskscan.connect.service;

import com.google.api.client.http.GenericUrl;
import com.google.api.client.http.HttpRequest;
import com.google.api.client.http.HttpRequestFactory;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.http.json.JsonHttpContent;
import com.google.api.client.json.GenericJson;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.util.Data;
import com.riskscan.connect.config.OAuthClientSettings;
import com.riskscan.connect.dto.RemoteContentItem;
import com.riskscan.connect.dto.tiktok.VideoListResponse;
import com.riskscan.connect.exception.RemoteApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads one page of the connected user's recent posts.
 */
@Component
public class ContentListClient {

    private static final Logger logger = LoggerFactory.getLogger(ContentListClient.class);

    /**
     * The provider rejects larger pages; callers wanting more must page.
     */
    public static final int MAX_PAGE_SIZE = 50;

    static final String VIDEO_FIELDS = "id,title,video_description,create_time,cover_image_url,share_url";

    private final OAuthClientSettings settings;
    private final HttpRequestFactory requestFactory;
    private final JsonFactory jsonFactory;

    public ContentListClient(OAuthClientSettings settings,
                             HttpTransport providerHttpTransport,
                             JsonFactory providerJsonFactory) {
        this.settings = settings;
        this.requestFactory = ProviderHttp.requestFactory(providerHttpTransport, settings.getTimeoutSeconds());
        this.jsonFactory = providerJsonFactory;
    }

    /**
     * @param maxCount requested page size, clamped to 1..{@value #MAX_PAGE_SIZE}
     * @return one entry per listed video; entries whose fields could not be converted are flagged malformed
     * @throws RemoteApiException on any non-2xx status, provider error code or unreadable envelope
     */
    public List<RemoteContentItem> listRecent(String accessToken, int maxCount) {
        int pageSize = Math.max(1, Math.min(maxCount, MAX_PAGE_SIZE));
        ProviderHttp.ProviderResponse response;
        try {
            GenericUrl url = new GenericUrl(settings.getVideoListUrl());
            url.set("fields", VIDEO_FIELDS);
            HttpRequest request = requestFactory.buildPostRequest(url,
                    new JsonHttpContent(jsonFactory, Map.of("max_count", pageSize)));
            request.getHeaders().setAuthorization("Bearer " + accessToken);
            response = ProviderHttp.execute(request);
        } catch (IOException e) {
            logger.warn("Content list request failed: {}", e.getMessage());
            throw new RemoteApiException("Content list endpoint unreachable: " + e.getMessage(), e);
        }
        if (!response.isSuccess()) {
            logger.warn("Content list request rejected with status {}", response.status());
            throw new RemoteApiException("Content list request rejected (" + response.status() + ")",
                    response.status(), response.body());
        }

        VideoListResponse parsed;
        try {
            parsed = jsonFactory.fromString(response.body(), VideoListResponse.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new RemoteApiException("Malformed content list response", response.status(), response.body());
        }
        if (parsed == null) {
            throw new RemoteApiException("Empty content list response", response.status(), response.body());
        }
        if (parsed.getError() != null && !parsed.getError().isOk()) {
            throw new RemoteApiException("Content list failed: " + parsed.getError().getCode(),
                    response.status(), response.body());
        }

        List<RemoteContentItem> items = new ArrayList<>();
        if (parsed.getData() == null || parsed.getData().getVideos() == null) {
            return items;
        }
        for (GenericJson raw : parsed.getData().getVideos()) {
            items.add(convert(raw));
        }
        logger.debug("Content list returned {} items (requested {})", items.size(), pageSize);
        return items;
    }

    /**
     * Binds one list entry to {@link VideoListResponse.Video}. A type mismatch marks only this entry as malformed.
     */
    private RemoteContentItem convert(GenericJson raw) {
        if (Data.isNull(raw)) {
            logger.warn("Content list contained a null entry");
            return RemoteContentItem.malformed(null);
        }
        try {
            VideoListResponse.Video video = jsonFactory.fromString(jsonFactory.toString(raw), VideoListResponse.Video.class);
            return toRemoteItem(video);
        } catch (IOException | IllegalArgumentException e) {
            Object id = raw.get("id");
            logger.warn("Malformed content list entry {}: {}", id, e.getMessage());
            return RemoteContentItem.malformed(id == null ? null : id.toString());
        }
    }

    private static RemoteContentItem toRemoteItem(VideoListResponse.Video video) {
        String caption = video.getVideoDescription();
        if (caption == null || caption.isBlank()) {
            caption = video.getTitle();
        }
        LocalDateTime createdAt = video.getCreateTime() == null ? null
                : LocalDateTime.ofInstant(Instant.ofEpochSecond(video.getCreateTime()), ZoneOffset.UTC);
        return new RemoteContentItem(video.getId(), caption, video.getCoverImageUrl(), createdAt, video.getShareUrl());
    }
}
