package com.signal.corroboration.fetch;

import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Picks a fresh identity profile for every attempt, never the same one twice in a row
 * when more than one profile is available.
 */
public class IdentityRotator {

    private static final Map<String, String> CHROME_HEADERS = Map.of(
            "Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,image/avif,image/webp,*/*;q=0.8",
            "Accept-Language", "en-US,en;q=0.9,ar;q=0.8",
            "Cache-Control", "max-age=0",
            "Sec-Ch-Ua-Mobile", "?0",
            "Sec-Fetch-Dest", "document",
            "Sec-Fetch-Mode", "navigate",
            "Sec-Fetch-Site", "none",
            "Sec-Fetch-User", "?1",
            "Upgrade-Insecure-Requests", "1");

    private static final Map<String, String> FIREFOX_HEADERS = Map.of(
            "Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8",
            "Accept-Language", "en-US,en;q=0.5",
            "Upgrade-Insecure-Requests", "1",
            "Sec-Fetch-Dest", "document",
            "Sec-Fetch-Mode", "navigate");

    private static final Map<String, String> SAFARI_HEADERS = Map.of(
            "Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8",
            "Accept-Language", "en-GB,en;q=0.9");

    public static final List<IdentityProfile> DEFAULT_PROFILES = List.of(
            new IdentityProfile("Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
                    + "(KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36", CHROME_HEADERS),
            new IdentityProfile("Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 "
                    + "(KHTML, like Gecko) Chrome/123.0.0.0 Safari/537.36", CHROME_HEADERS),
            new IdentityProfile("Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
                    + "(KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36 Edg/124.0.0.0", CHROME_HEADERS),
            new IdentityProfile("Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:125.0) Gecko/20100101 "
                    + "Firefox/125.0", FIREFOX_HEADERS),
            new IdentityProfile("Mozilla/5.0 (X11; Ubuntu; Linux x86_64; rv:124.0) Gecko/20100101 "
                    + "Firefox/124.0", FIREFOX_HEADERS),
            new IdentityProfile("Mozilla/5.0 (Macintosh; Intel Mac OS X 14_4_1) AppleWebKit/605.1.15 "
                    + "(KHTML, like Gecko) Version/17.4.1 Safari/605.1.15", SAFARI_HEADERS)
    );

    private final List<IdentityProfile> profiles;
    private final Random random;
    private int lastIndex = -1;

    public IdentityRotator() {
        this(DEFAULT_PROFILES, new Random());
    }

    public IdentityRotator(List<IdentityProfile> profiles, Random random) {
        if (profiles == null || profiles.isEmpty()) {
            throw new IllegalArgumentException("at least one identity profile is required");
        }
        this.profiles = List.copyOf(profiles);
        this.random = random;
    }

    public synchronized IdentityProfile next() {
        int index;
        if (profiles.size() == 1) {
            index = 0;
        } else if (lastIndex < 0) {
            index = random.nextInt(profiles.size());
        } else {
            // draw among the other profiles, skipping over the previous one
            index = random.nextInt(profiles.size() - 1);
            if (index >= lastIndex) {
                index++;
            }
        }
        lastIndex = index;
        return profiles.get(index);
    }
}
