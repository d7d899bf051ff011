package com.arbor.lookup;

import java.util.Optional;

/**
 * Loan purposes accepted by the loan-purpose tree.
 * Tool callers send the lower-case {@link #value()}; trees name the constants.
 */
public enum LoanPurpose {
    HOME("home"),
    CAR("car"),
    EDUCATION("education");

    private final String value;

    LoanPurpose(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Find the purpose named by text, matching either the value or the constant name, ignoring case.
     */
    public static Optional<LoanPurpose> fromValue(String text) {
        for (LoanPurpose purpose : values()) {
            if (purpose.value.equalsIgnoreCase(text.trim()) || purpose.name().equalsIgnoreCase(text.trim())) {
                return Optional.of(purpose);
            }
        }
        return Optional.empty();
    }
}
