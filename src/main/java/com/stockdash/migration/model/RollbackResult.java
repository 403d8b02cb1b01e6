package com.stockdash.migration.model;

public record RollbackResult(boolean success, String error) {
    public static RollbackResult ok() {
        return new RollbackResult(true, null);
    }

    public static RollbackResult failed(String error) {
        return new RollbackResult(false, error == null ? "" : error);
    }
}
