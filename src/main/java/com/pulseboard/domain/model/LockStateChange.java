package com.pulseboard.domain.model;

import java.util.List;

/**
 * Lock state delivered to lock-change listeners after an engage or release. Allowed keys
 * keep the first-seen order of the lock request.
 */
public record LockStateChange(boolean active, List<String> allowedKeys) {

    public LockStateChange {
        allowedKeys = allowedKeys != null ? List.copyOf(allowedKeys) : List.of();
    }
}
