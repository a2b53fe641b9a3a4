package com.bko.healthexport.healthdata;

import java.io.IOException;

public class HealthDataException extends IOException {

    public HealthDataException(String message) {
        super(message);
    }

    public HealthDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
