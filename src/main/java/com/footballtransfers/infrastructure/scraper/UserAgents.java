package com.footballtransfers.infrastructure.scraper;

import java.util.List;
import java.util.Random;

/**
 * Browser user agents rotated across requests.
 */
public final class UserAgents {

    private static final List<String> AGENTS = List.of(
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10.15; rv:125.0) Gecko/20100101 Firefox/125.0",
        "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/123.0.0.0 Safari/537.36"
    );

    private UserAgents() {
    }

    public static String pick(Random random) {
        return AGENTS.get(random.nextInt(AGENTS.size()));
    }

    public static List<String> all() {
        return AGENTS;
    }
}
