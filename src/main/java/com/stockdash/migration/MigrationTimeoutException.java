package com.stockdash.migration;

import java.util.concurrent.TimeoutException;

public class MigrationTimeoutException extends TimeoutException {
    public MigrationTimeoutException(String message) {
        super(message);
    }
}
