package com.riskscan.connect.dto.tiktok;

import com.google.api.client.json.GenericJson;
import com.google.api.client.util.Key;

public class UserInfoResponse extends GenericJson {

    @Key
    private Data data;

    @Key
    private TikTokError error;

    public Data getData() { return data; }
    public TikTokError getError() { return error; }

    public static class Data extends GenericJson {
        @Key
        private User user;

        public User getUser() { return user; }
    }

    public static class User extends GenericJson {
        @Key("open_id")
        private String openId;

        @Key("union_id")
        private String unionId;

        @Key("display_name")
        private String displayName;

        @Key("avatar_url")
        private String avatarUrl;

        public String getOpenId() { return openId; }
        public String getUnionId() { return unionId; }
        public String getDisplayName() { return displayName; }
        public String getAvatarUrl() { return avatarUrl; }
    }
}
