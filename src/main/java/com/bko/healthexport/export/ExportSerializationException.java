package com.bko.healthexport.export;

import java.io.IOException;

public class ExportSerializationException extends IOException {

    public ExportSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
