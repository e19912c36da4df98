package com.flagship.admissions_payment.payment.exception;

import java.util.UUID;

public class ApplicationNotFoundException extends ResourceNotFoundException {

    public ApplicationNotFoundException(UUID applicationId) {
        super("Application", String.valueOf(applicationId));
    }
}
