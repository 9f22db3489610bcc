package com.riskscan.connect.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Counts from one ingestion run. {@code fetchedCount} is the number of items the provider returned.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IngestionResult {
    private int ingestedCount;
    private int duplicateCount;
    private int rejectedCount;
    private int fetchedCount;
}
