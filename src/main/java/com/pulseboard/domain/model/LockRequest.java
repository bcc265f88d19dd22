package com.pulseboard.domain.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Request to engage the subscription lock.
 *
 * <p>Either {@link #denyAll()} (no fast subscription survives) or {@link #allow(Collection)}
 * with the keys shown in the focused view. Allowed keys are deduplicated in first-seen
 * order; null and blank entries are dropped, so an allow-list that ends up empty behaves
 * exactly like deny-all.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class LockRequest {

    private static final LockRequest DENY_ALL = new LockRequest(Set.of());

    private final Set<String> allowedKeys;

    private LockRequest(Set<String> allowedKeys) {
        this.allowedKeys = allowedKeys;
    }

    public static LockRequest denyAll() {
        return DENY_ALL;
    }

    public static LockRequest allow(Collection<String> keys) {
        if (keys == null || keys.isEmpty()) {
            return DENY_ALL;
        }
        Set<String> allowed = new LinkedHashSet<>();
        for (String key : keys) {
            if (key != null && !key.isBlank()) {
                allowed.add(key);
            }
        }
        return allowed.isEmpty() ? DENY_ALL : new LockRequest(Collections.unmodifiableSet(allowed));
    }

    public static LockRequest allow(String... keys) {
        return allow(keys != null ? Arrays.asList(keys) : null);
    }

    public boolean isDenyAll() {
        return allowedKeys.isEmpty();
    }
}
