package com.riskscan.connect.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScanRequest {

    @NotNull(message = "caption is required")
    private String caption;

    // "platform" (default) or "upload"
    @Pattern(regexp = "platform|upload", message = "mode must be platform or upload")
    private String mode;

    @DecimalMin("-90.0")
    @DecimalMax("90.0")
    private Double gpsLatitude;

    @DecimalMin("-180.0")
    @DecimalMax("180.0")
    private Double gpsLongitude;
}
