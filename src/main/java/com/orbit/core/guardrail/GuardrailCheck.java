package com.orbit.core.guardrail;

/**
 * Result of a guardrail evaluation.
 *
 * @param passed whether the cycle may proceed
 * @param reason "memory" or "concurrency" when failed, null when passed
 * @param detail human-readable explanation
 */
public record GuardrailCheck(boolean passed, String reason, String detail) {

    public static final String MEMORY = "memory";
    public static final String CONCURRENCY = "concurrency";

    private static final GuardrailCheck OK = new GuardrailCheck(true, null, "within limits");

    public static GuardrailCheck ok() {
        return OK;
    }

    public static GuardrailCheck failed(String reason, String detail) {
        return new GuardrailCheck(false, reason, detail);
    }
}
