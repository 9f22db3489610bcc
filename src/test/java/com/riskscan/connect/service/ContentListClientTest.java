package com.riskscan.connect.service;

import com.google.api.client.json.gson.GsonFactory;
import com.riskscan.connect.dto.RemoteContentItem;
import com.riskscan.connect.exception.RemoteApiException;
import com.riskscan.connect.support.RecordingHttpTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContentListClientTest {

    private RecordingHttpTransport transport;
    private ContentListClient client;

    @BeforeEach
    void setUp() {
        transport = new RecordingHttpTransport();
        client = new ContentListClient(TokenExchangeClientTest.settings("awkey123456"), transport,
                GsonFactory.getDefaultInstance());
    }

    @Test
    void listRecentMapsVideos() {
        transport.respond(200, "{\"data\":{\"videos\":["
                + "{\"id\":\"7001\",\"title\":\"t1\",\"video_description\":\"At the campus gym\","
                + "\"create_time\":1714557600,\"cover_image_url\":\"https://cdn/c1.jpg\",\"share_url\":\"https://s/1\"},"
                + "{\"id\":\"7002\",\"title\":\"Only a title\",\"create_time\":1714557660}"
                + "],\"cursor\":1714557600000,\"has_more\":false},"
                + "\"error\":{\"code\":\"ok\",\"message\":\"\"}}");

        List<RemoteContentItem> items = client.listRecent("act.1", 20);

        assertThat(items).hasSize(2);
        RemoteContentItem first = items.get(0);
        assertThat(first.getExternalItemId()).isEqualTo("7001");
        assertThat(first.getCaption()).isEqualTo("At the campus gym");
        assertThat(first.getCoverUrl()).isEqualTo("https://cdn/c1.jpg");
        assertThat(first.getShareUrl()).isEqualTo("https://s/1");
        assertThat(first.getCreatedAt()).isEqualTo(LocalDateTime.of(2024, 5, 1, 10, 0));
        assertThat(items.get(1).getCaption()).isEqualTo("Only a title");

        RecordingHttpTransport.RecordedRequest request = transport.lastRequest();
        assertThat(request.method()).isEqualTo("POST");
        assertThat(request.authorization()).isEqualTo("Bearer act.1");
        assertThat(request.url()).contains("fields=").contains("video_description");
        assertThat(request.body()).isEqualTo("{\"max_count\":20}");
    }

    @Test
    void badlyTypedEntryIsFlaggedAndTheRestAreKept() {
        transport.respond(200, "{\"data\":{\"videos\":["
                + "{\"id\":\"7001\",\"video_description\":\"Had a great day!\",\"create_time\":1714557600},"
                + "{\"id\":\"7002\",\"video_description\":\"Later\",\"create_time\":\"yesterday\"},"
                + "{\"id\":7003,\"title\":\"numeric id\"}"
                + "]},\"error\":{\"code\":\"ok\"}}");

        List<RemoteContentItem> items = client.listRecent("act.1", 10);

        assertThat(items).hasSize(3);
        assertThat(items.get(0).isMalformed()).isFalse();
        assertThat(items.get(0).getExternalItemId()).isEqualTo("7001");
        assertThat(items.get(0).getCreatedAt()).isEqualTo(LocalDateTime.of(2024, 5, 1, 10, 0));
        assertThat(items.get(1).isMalformed()).isTrue();
        assertThat(items.get(1).getExternalItemId()).isEqualTo("7002");
        assertThat(items.get(1).getCaption()).isNull();
        assertThat(items.get(2).isMalformed()).isTrue();
    }

    @Test
    void unparsableEnvelopeIsRaised() {
        transport.respond(200, "{\"data\":[\"x\"],\"error\":{\"code\":\"ok\"}}");

        assertThatThrownBy(() -> client.listRecent("act.1", 10))
                .isInstanceOfSatisfying(RemoteApiException.class,
                        e -> assertThat(e.getMessage()).contains("Malformed content list response"));
    }

    @Test
    void pageSizeIsClampedToProviderMaximum() {
        transport.respond(200, "{\"data\":{\"videos\":[]},\"error\":{\"code\":\"ok\"}}");

        client.listRecent("act.1", 80);

        assertThat(transport.lastRequest().body()).isEqualTo("{\"max_count\":50}");
    }

    @Test
    void missingDataYieldsEmptyList() {
        transport.respond(200, "{\"error\":{\"code\":\"ok\"}}");

        assertThat(client.listRecent("act.1", 10)).isEmpty();
    }

    @Test
    void providerErrorCodeIsRaised() {
        String body = "{\"data\":{},\"error\":{\"code\":\"scope_not_authorized\",\"message\":\"video.list\"}}";
        transport.respond(200, body);

        assertThatThrownBy(() -> client.listRecent("act.1", 10))
                .isInstanceOfSatisfying(RemoteApiException.class, e -> {
                    assertThat(e.getUpstreamStatus()).isEqualTo(200);
                    assertThat(e.getUpstreamBody()).isEqualTo(body);
                    assertThat(e.getMessage()).contains("scope_not_authorized");
                });
    }

    @Test
    void serverErrorIsRaised() {
        transport.respond(503, "upstream unavailable");

        assertThatThrownBy(() -> client.listRecent("act.1", 10))
                .isInstanceOfSatisfying(RemoteApiException.class,
                        e -> assertThat(e.getUpstreamStatus()).isEqualTo(503));
    }

    @Test
    void ioFailureIsRaised() {
        transport.fail(new IOException("connection reset"));

        assertThatThrownBy(() -> client.listRecent("act.1", 10))
                .isInstanceOfSatisfying(RemoteApiException.class,
                        e -> assertThat(e.getUpstreamStatus()).isEqualTo(-1));
    }
}
