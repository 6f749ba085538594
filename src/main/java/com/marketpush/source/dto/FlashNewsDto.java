package com.marketpush.source.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class FlashNewsDto {

    private String id;
    private String title;
    private String content;
    private String timestamp;
    private String source;
    private String url;
    private String symbol;
}
