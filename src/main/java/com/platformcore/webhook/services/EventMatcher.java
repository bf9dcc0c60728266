package com.platformcore.webhook.services;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import com.platformcore.webhook.models.WebhookSubscription;

/**
 * Selects the subscriptions that should receive an event.
 *
 * <p>Patterns are either exact event types or globs where {@code *} matches any run of
 * characters, dots included: {@code bonus.*} matches {@code bonus.awarded} and
 * {@code bonus.tier.upgraded}.
 */
public class EventMatcher {

    static final int MAX_COMPILED_PATTERNS = 1024;

    // least recently used patterns are dropped once the cache is full
    private static final Map<String, Pattern> COMPILED = Collections.synchronizedMap(
        new LinkedHashMap<String, Pattern>(64, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Pattern> eldest) {
                return size() > MAX_COMPILED_PATTERNS;
            }
        });

    private final WebhookStore store;
    private final int maxConsecutiveFailures;

    public EventMatcher(WebhookStore store, int maxConsecutiveFailures) {
        this.store = store;
        this.maxConsecutiveFailures = maxConsecutiveFailures;
    }

    public List<WebhookSubscription> findMatching(String tenantId, String eventType) {
        return store.findByTenant(tenantId).stream()
            .filter(WebhookSubscription::isActiveSubscription)
            .filter(subscription -> subscription.getConsecutiveFailures() < maxConsecutiveFailures)
            .filter(subscription -> matchesAny(subscription, eventType))
            .collect(Collectors.toList());
    }

    static boolean matchesAny(WebhookSubscription subscription, String eventType) {
        if (subscription.getEvents() == null) {
            return false;
        }
        return subscription.getEvents().stream().anyMatch(pattern -> matches(pattern, eventType));
    }

    public static boolean matches(String pattern, String eventType) {
        if (pattern == null || eventType == null) {
            return false;
        }
        if (pattern.equals(eventType)) {
            return true;
        }
        if (pattern.indexOf('*') < 0) {
            return false;
        }
        return COMPILED.computeIfAbsent(pattern, EventMatcher::compile).matcher(eventType).matches();
    }

    static int compiledPatternCount() {
        return COMPILED.size();
    }

    /**
     * Translates a glob into an anchored regular expression. Everything except {@code *} is
     * quoted, so dots and other metacharacters match literally.
     */
    static Pattern compile(String glob) {
        StringBuilder regex = new StringBuilder("^");
        int start = 0;
        for (int i = 0; i < glob.length(); i++) {
            if (glob.charAt(i) == '*') {
                if (i > start) {
                    regex.append(Pattern.quote(glob.substring(start, i)));
                }
                regex.append(".*");
                start = i + 1;
            }
        }
        if (start < glob.length()) {
            regex.append(Pattern.quote(glob.substring(start)));
        }
        return Pattern.compile(regex.append('$').toString());
    }
}
