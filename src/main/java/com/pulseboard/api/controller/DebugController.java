package com.pulseboard.api.controller;

import com.pulseboard.domain.model.SubscriptionMetrics;
import com.pulseboard.subscription.SubscriptionAdmissionController;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Debug endpoints for inspecting live-update subscription state.
 *
 * <p>Feeds the dashboard's subscription debug overlay: pool sizes and keys, enforced and
 * normal limits, lock state and per-pane row counts. All endpoints are read-only.
 */
@RestController
@RequestMapping("/api/debug")
public class DebugController {

    private final SubscriptionAdmissionController subscriptionAdmissionController;

    public DebugController(SubscriptionAdmissionController subscriptionAdmissionController) {
        this.subscriptionAdmissionController = subscriptionAdmissionController;
    }

    @GetMapping("/subscriptions")
    public SubscriptionMetrics getSubscriptions() {
        return subscriptionAdmissionController.getSubscriptionMetrics();
    }
}
