package com.localcooks.booking.security;

import com.localcooks.common.exception.BusinessException;

public class UnauthenticatedException extends BusinessException {

    public UnauthenticatedException(String message) {
        super(message, "UNAUTHENTICATED");
    }
}
