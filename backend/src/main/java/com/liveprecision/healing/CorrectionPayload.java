package com.liveprecision.healing;

import lombok.Builder;

/**
 * Concrete changes a correction proposes. Null fields are left unchanged.
 */
@Builder(toBuilder = true)
public record CorrectionPayload(
        String operand1,
        String operand2,
        Integer precisionOverride,
        boolean useCache,
        Integer cacheTimeoutSeconds,
        boolean useMemoryCache,
        String explanation
) {

    /** True when re-running the calculation with this payload could produce a different outcome. */
    public boolean isRetryable() {
        return operand1 != null || operand2 != null || precisionOverride != null;
    }
}
