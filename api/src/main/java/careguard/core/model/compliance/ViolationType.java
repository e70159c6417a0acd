package careguard.core.model.compliance;

/**
 * Policy violations recognised by the compliance analyzer.
 */
public enum ViolationType {
    EXCESSIVE_FAILED_LOGINS("Lock or verify the account and review the source of the failed attempts"),
    AFTER_HOURS_ACCESS("Confirm the access was authorised outside business hours"),
    BULK_DATA_ACCESS("Review the accessed records and confirm a legitimate need for bulk access"),
    SUSPICIOUS_ACCESS_PATTERN("Verify the session with the account holder and consider revoking it");

    private final String remediation;

    ViolationType(String remediation) {
        this.remediation = remediation;
    }

    public String remediation() {
        return remediation;
    }
}
