package dev.resumematcher.exception;

/**
 * Raised when a rejected match is used where an active candidate is required,
 * such as interview scheduling.
 */
public class MatchRejectedException extends RuntimeException {

    public MatchRejectedException(Long matchId) {
        super("Match " + matchId + " is rejected and cannot be scheduled");
    }
}
