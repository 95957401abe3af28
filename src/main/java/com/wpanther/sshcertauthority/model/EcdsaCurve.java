package com.wpanther.sshcertauthority.model;

/**
 * NIST curves usable for a CA key, with the SSH names and digest each one is paired with
 */
public enum EcdsaCurve {

    NISTP256("nistp256", "SHA-256", 32, 256),
    NISTP384("nistp384", "SHA-384", 48, 384),
    NISTP521("nistp521", "SHA-512", 66, 521);

    private final String sshName;
    private final String digestAlgorithm;
    private final int componentWidth;
    private final int fieldSize;

    EcdsaCurve(String sshName, String digestAlgorithm, int componentWidth, int fieldSize) {
        this.sshName = sshName;
        this.digestAlgorithm = digestAlgorithm;
        this.componentWidth = componentWidth;
        this.fieldSize = fieldSize;
    }

    public String getSshName() {
        return sshName;
    }

    /**
     * SSH key type and signature type string, e.g. {@code ecdsa-sha2-nistp256}
     */
    public String getKeyType() {
        return "ecdsa-sha2-" + sshName;
    }

    public String getDigestAlgorithm() {
        return digestAlgorithm;
    }

    /**
     * Width in bytes of each of the r and s components
     */
    public int getComponentWidth() {
        return componentWidth;
    }

    public int getFieldSize() {
        return fieldSize;
    }

    public static EcdsaCurve fromFieldSize(int fieldSize) {
        for (EcdsaCurve curve : values()) {
            if (curve.fieldSize == fieldSize) {
                return curve;
            }
        }
        throw new IllegalArgumentException("Unsupported EC field size: " + fieldSize);
    }

    public static EcdsaCurve fromKeyType(String keyType) {
        for (EcdsaCurve curve : values()) {
            if (curve.getKeyType().equals(keyType)) {
                return curve;
            }
        }
        throw new IllegalArgumentException("Unsupported ECDSA key type: " + keyType);
    }

    public static boolean isEcdsaKeyType(String keyType) {
        for (EcdsaCurve curve : values()) {
            if (curve.getKeyType().equals(keyType)) {
                return true;
            }
        }
        return false;
    }
}
