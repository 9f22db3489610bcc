package com.riskscan.connect.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error body. Upstream fields are set only when a provider call failed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private String message;
    private String stage;
    private Integer upstreamStatus;
    private String upstreamBody;

    public ErrorResponse(String message) {
        this.message = message;
    }
}
