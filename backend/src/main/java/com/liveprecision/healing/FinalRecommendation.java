package com.liveprecision.healing;

public record FinalRecommendation(String action, double confidence, String message) {

    public static final String AUTO_FIX_APPLIED = "auto_fix_applied";
    public static final String MITIGATION_APPLIED = "mitigation_applied";
    public static final String MANUAL_INTERVENTION_REQUIRED = "manual_intervention_required";
    public static final String ESCALATE = "escalate";
}
