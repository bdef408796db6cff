package com.sentinel.core.change;

/**
 * @param successful whether the rollback procedure completed
 * @param detail     what the executor did or why it failed
 */
public record RollbackReport(boolean successful, String detail) {

    public static RollbackReport success(String detail) {
        return new RollbackReport(true, detail);
    }

    public static RollbackReport failure(String detail) {
        return new RollbackReport(false, detail);
    }
}
