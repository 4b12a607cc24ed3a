package com.risk.ftree.api;

/**
 * Common-cause failure models known to the MEF.
 * Serialization currently supports {@link #MGL} only.
 */
public enum CcfModel {
    BETA_FACTOR("beta-factor"),
    /** Multiple Greek Letter. */
    MGL("MGL"),
    ALPHA_FACTOR("alpha-factor"),
    PHI_FACTOR("phi-factor");

    private final String token;

    CcfModel(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    public static CcfModel fromString(String text) {
        for (CcfModel model : values()) {
            if (model.token.equalsIgnoreCase(text))
                return model;
        }
        throw new IllegalArgumentException("Unknown CcfModel: " + text);
    }
}
