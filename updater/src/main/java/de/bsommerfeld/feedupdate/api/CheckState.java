package de.bsommerfeld.feedupdate.api;

/**
 * Stages of one update cycle.
 *
 * <pre>
 * IDLE -> FETCHING -> PARSED -> DECIDING -+-> NO_UPDATE_REPORTED (forced checks only)
 *                                         |
 *                                         +-> UPDATE_OFFERED -> DOWNLOADING -> TRUST_GATING -+-> READY
 *                                                                                            |
 *                                                                                            +-> REJECTED
 * </pre>
 *
 * Every cycle ends back in {@link #IDLE}, including failed, declined and
 * cancelled ones.
 */
public enum CheckState {
    IDLE,
    FETCHING,
    PARSED,
    DECIDING,
    NO_UPDATE_REPORTED,
    UPDATE_OFFERED,
    DOWNLOADING,
    TRUST_GATING,
    READY,
    REJECTED
}
