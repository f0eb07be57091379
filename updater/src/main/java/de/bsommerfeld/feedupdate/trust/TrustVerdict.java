package de.bsommerfeld.feedupdate.trust;

/**
 * Outcome of checking a downloaded artifact against the feed's signature.
 */
public enum TrustVerdict {

    /** The signature matches the artifact under the trusted key. */
    VERIFIED,

    /**
     * The feed carried no signature. The artifact may run, but the
     * missing check must be surfaced as a warning.
     */
    NO_SIGNATURE_PRESENT,

    /** The artifact must be deleted and never executed. */
    VERIFICATION_FAILED;

    public boolean allowsExecution() {
        return this != VERIFICATION_FAILED;
    }
}
