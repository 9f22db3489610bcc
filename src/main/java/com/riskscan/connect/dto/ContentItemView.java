package com.riskscan.connect.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.riskscan.connect.entity.ContentItem;
import com.riskscan.connect.scoring.RiskBand;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ContentItemView {
    private String externalItemId;
    private String caption;
    private String coverUrl;
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime createdAtRemote;
    private String shareUrl;
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime scannedAt;
    private int score;
    private RiskBand band;
    private Map<String, Object> factors;
    private List<String> detections;
    private List<String> recommendations;

    public static ContentItemView from(ContentItem item) {
        return new ContentItemView(
                item.getExternalItemId(),
                item.getCaption(),
                item.getCoverUrl(),
                item.getCreatedAtRemote(),
                item.getShareUrl(),
                item.getScannedAt(),
                item.getScore() == null ? 0 : item.getScore(),
                item.getBand(),
                item.getFactors(),
                item.getDetections(),
                item.getRecommendations());
    }
}
