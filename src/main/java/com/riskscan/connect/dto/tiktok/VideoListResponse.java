package com.riskscan.connect.dto.tiktok;

import com.google.api.client.json.GenericJson;
import com.google.api.client.util.Key;

import java.util.List;

public class VideoListResponse extends GenericJson {

    @Key
    private Data data;

    @Key
    private TikTokError error;

    public Data getData() { return data; }
    public TikTokError getError() { return error; }

    public static class Data extends GenericJson {
        // Bound loosely; each entry is converted to a Video on its own
        @Key
        private List<GenericJson> videos;

        public List<GenericJson> getVideos() { return videos; }
    }

    public static class Video extends GenericJson {
        @Key
        private String id;

        @Key
        private String title;

        @Key("video_description")
        private String videoDescription;

        // Unix seconds
        @Key("create_time")
        private Long createTime;

        @Key("cover_image_url")
        private String coverImageUrl;

        @Key("share_url")
        private String shareUrl;

        public String getId() { return id; }
        public String getTitle() { return title; }
        public String getVideoDescription() { return videoDescription; }
        public Long getCreateTime() { return createTime; }
        public String getCoverImageUrl() { return coverImageUrl; }
        public String getShareUrl() { return shareUrl; }
    }
}
