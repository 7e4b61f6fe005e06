package com.wpanther.cgaca.dto.verification;

import com.wpanther.cgaca.entity.VerificationResult;

public enum LiveVerificationOutcome {
    VALID(VerificationResult.VALID),
    INVALID(VerificationResult.INVALID),
    REVOKED(VerificationResult.REVOKED),
    EXPIRED(VerificationResult.EXPIRED),
    // Live golden thread differs from the certified one
    MISMATCH(VerificationResult.INVALID);

    private final VerificationResult historyResult;

    LiveVerificationOutcome(VerificationResult historyResult) {
        this.historyResult = historyResult;
    }

    public VerificationResult getHistoryResult() {
        return historyResult;
    }
}
