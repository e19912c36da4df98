package com.flagship.admissions_payment.payment.exception;

import java.util.UUID;

public class UserNotFoundException extends ResourceNotFoundException {

    public UserNotFoundException(UUID userId) {
        super("User", String.valueOf(userId));
    }
}
