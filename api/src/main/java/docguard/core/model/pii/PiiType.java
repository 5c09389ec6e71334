package docguard.core.model.pii;

/**
 * Kinds of personally identifying data recognised in field values.
 */
public enum PiiType {
    ISRAELI_ID,
    CREDIT_CARD,
    EMAIL,
    PHONE
}
