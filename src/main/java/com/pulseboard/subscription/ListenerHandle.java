package com.pulseboard.subscription;

/** Opaque handle returned by a listener registration; pass it back to unsubscribe. */
public record ListenerHandle(String registry, long id) {}
