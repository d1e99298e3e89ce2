package org.silverscript.debug;

/**
 * Where a variable binding comes from.
 */
public enum VariableOrigin {
    CONSTRUCTOR_PARAMETER("const"),
    FUNCTION_PARAMETER("arg"),
    LOCAL("local");

    private final String label;

    VariableOrigin(String label) {
        this.label = label;
    }

    /**
     * @return The short label used in traces.
     */
    public String label() {
        return label;
    }
}
