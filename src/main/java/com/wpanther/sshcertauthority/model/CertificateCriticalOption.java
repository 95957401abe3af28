package com.wpanther.sshcertauthority.model;

/**
 * Critical options defined by OpenSSH. Verifiers reject certificates carrying
 * critical options they do not recognise.
 */
public enum CertificateCriticalOption {

    FORCE_COMMAND("force-command"),
    SOURCE_ADDRESS("source-address"),
    VERIFY_REQUIRED("verify-required");

    private final String optionName;

    CertificateCriticalOption(String optionName) {
        this.optionName = optionName;
    }

    public String getOptionName() {
        return optionName;
    }

    public static boolean isKnown(String optionName) {
        for (CertificateCriticalOption option : values()) {
            if (option.optionName.equals(optionName)) {
                return true;
            }
        }
        return false;
    }
}
