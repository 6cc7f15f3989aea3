package com.geekhub.collector.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RssHubSettings {

    private boolean enabled;

    /**
     * Instance base URL, e.g. {@code https://rsshub.example.org}.
     */
    private String url;
}
