package com.risk.ftree.api;

/**
 * Logical operators of gate formulas, named by their OpenPSA MEF tokens.
 *
 * <p>
 * Only {@link #ATLEAST} takes a parameter (the k-out-of-n threshold).
 * {@link #NULL} is a pass-through gate: its formula has no operator wrapper.
 */
public enum Operator {
    AND("and"),
    OR("or"),
    ATLEAST("atleast"),
    NOT("not"),
    XOR("xor"),
    NAND("nand"),
    NOR("nor"),
    NULL("null");

    private final String token;

    Operator(String token) {
        this.token = token;
    }

    /** The MEF element name of this operator. */
    public String token() {
        return token;
    }

    public boolean requiresThreshold() {
        return this == ATLEAST;
    }

    public static Operator fromString(String text) {
        for (Operator op : values()) {
            if (op.token.equalsIgnoreCase(text))
                return op;
        }
        throw new IllegalArgumentException("Unknown Operator: " + text);
    }
}
