package com.localcooks.booking.notification;

/**
 * Tells the chef how a booking was decided. Best-effort: implementations log failures and never throw.
 */
public interface NotificationDispatcher {

    void notify(Long chefId, Long bookingId, DecisionSummary summary);
}
