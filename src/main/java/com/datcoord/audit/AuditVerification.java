package com.datcoord.audit;

public record AuditVerification(
        boolean intact,
        int entries,
        int firstBrokenLine,
        String message) {

    static AuditVerification ok(int entries) {
        return new AuditVerification(true, entries, 0, "ok");
    }

    static AuditVerification broken(int entries, int line, String message) {
        return new AuditVerification(false, entries, line, message);
    }
}
