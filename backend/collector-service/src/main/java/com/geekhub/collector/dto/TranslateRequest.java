package com.geekhub.collector.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of a translation request; settings fall back to the configured provider when omitted.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TranslateRequest {

    private AiSettings aiSettings;
}
