package com.wpanther.sshcertauthority.model;

import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Extensions defined by OpenSSH. All of them are flags carrying an empty value.
 */
public enum CertificateExtension {

    NO_TOUCH_REQUIRED("no-touch-required"),
    PERMIT_X11_FORWARDING("permit-X11-forwarding"),
    PERMIT_AGENT_FORWARDING("permit-agent-forwarding"),
    PERMIT_PORT_FORWARDING("permit-port-forwarding"),
    PERMIT_PTY("permit-pty"),
    PERMIT_USER_RC("permit-user-rc");

    private final String extensionName;

    CertificateExtension(String extensionName) {
        this.extensionName = extensionName;
    }

    public String getExtensionName() {
        return extensionName;
    }

    /**
     * Every extension enabled, the default when a request names none
     */
    public static SortedMap<String, String> permitAll() {
        SortedMap<String, String> extensions = new TreeMap<>();
        for (CertificateExtension extension : values()) {
            extensions.put(extension.extensionName, "");
        }
        return extensions;
    }
}
