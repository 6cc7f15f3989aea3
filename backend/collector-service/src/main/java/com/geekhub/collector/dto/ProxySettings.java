package com.geekhub.collector.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * User-editable proxy settings.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProxySettings {

    private boolean enabled;

    /**
     * Check well-known local proxy ports instead of using host/port.
     */
    private boolean autoDetect;

    private String host;

    private String port;

    public static ProxySettings disabled() {
        return new ProxySettings(false, false, null, null);
    }
}
