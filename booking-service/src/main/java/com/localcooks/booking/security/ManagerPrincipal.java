package com.localcooks.booking.security;

/**
 * The manager an upstream gateway authenticated for this request.
 */
public record ManagerPrincipal(Long managerId) {

    public boolean owns(Long bookingManagerId) {
        return managerId.equals(bookingManagerId);
    }
}
