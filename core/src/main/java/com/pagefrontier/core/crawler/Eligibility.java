package com.pagefrontier.core.crawler;

/** RestrictionPolicy 판정 결과. ELIGIBLE 이외는 거절 사유. */
public enum Eligibility {
    ELIGIBLE,
    ALREADY_DONE,
    OUTSIDE_DOMAIN,
    OUTSIDE_PATH,
    EXCLUDED,
    MALFORMED;

    public boolean isEligible() { return this == ELIGIBLE; }
}
