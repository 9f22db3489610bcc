package com.riskscan.connect.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ContentPageResponse {
    private List<ContentItemView> items;
    private int page;
    private int pageSize;
    private long total;
}
