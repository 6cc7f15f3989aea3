package com.geekhub.collector.client;

import java.util.Map;

/**
 * Header set of a desktop browser; some origins reject requests without it.
 */
public final class BrowserHeaders {

    public static final String ACCEPT =
            "text/html,application/xhtml+xml,application/xml;q=0.9,image/avif,image/webp,image/apng,*/*;q=0.8,application/signed-exchange;v=b3;q=0.7";

    public static final String ACCEPT_LANGUAGE = "en,zh-CN;q=0.9,zh;q=0.8";

    private BrowserHeaders() {
    }

    public static Map<String, String> of(String userAgent) {
        return Map.of(
                "User-Agent", userAgent,
                "Accept", ACCEPT,
                "Accept-Language", ACCEPT_LANGUAGE
        );
    }
}
