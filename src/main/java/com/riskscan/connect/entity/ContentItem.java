package com.riskscan.connect.entity;

import com.riskscan.connect.scoring.RiskBand;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * One ingested remote post with the assessment computed when it was first seen.
 */
@Entity
@Table(name = "content_items")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ContentItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // Unique across all identities; the ingestion backstop relies on this constraint
    @Column(name = "external_item_id", nullable = false, unique = true)
    private String externalItemId;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "identity_id", nullable = false)
    private Identity identity;

    @Column(columnDefinition = "TEXT")
    private String caption;

    @Column(name = "cover_url", columnDefinition = "TEXT")
    private String coverUrl;

    @Column(name = "created_at_remote")
    private LocalDateTime createdAtRemote;

    @Column(name = "share_url", columnDefinition = "TEXT")
    private String shareUrl;

    @Column(name = "scanned_at", nullable = false)
    private LocalDateTime scannedAt;

    @Column(nullable = false)
    private Integer score;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private RiskBand band;

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> factors;

    @Convert(converter = JsonStringListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> detections;

    @Convert(converter = JsonStringListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> recommendations;
}
