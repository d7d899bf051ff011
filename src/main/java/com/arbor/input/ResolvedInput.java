package com.arbor.input;

/**
 * Input bound to a question node.
 *
 * @param name    Input name as supplied by the caller
 * @param subject Readable term for the input, used in trace entries (e.g. "credit score")
 * @param value   Input value
 */
public record ResolvedInput(
        String name,
        String subject,
        Object value
) {
}
