package io.github.hotbrkm.autobulk.dispatcher.recipient;

import java.net.IDN;
import java.util.Locale;

public final class EmailAddressUtil {
    /**
     * Label used when email/domain is determined to be invalid
     */
    public static final String INVALID = "INVALID";

    private EmailAddressUtil() {}

    /**
     * Returns the lower-cased ASCII domain of an address, accepting {@code "Name <user@host>"} forms,
     * or {@link #INVALID}.
     */
    public static String extractDomain(String email) {
        String addr = unwrap(email);
        if (addr == null) {
            return INVALID;
        }

        int at = addr.lastIndexOf('@');
        if (at <= 0 || at >= addr.length() - 1) {
            return INVALID;
        }
        String dom = addr.substring(at + 1).trim();
        if (dom.isEmpty() || dom.charAt(0) == '[') {
            return INVALID;
        }
        if (dom.endsWith(".")) {
            dom = dom.substring(0, dom.length() - 1);
        }

        String asciiDom;
        try {
            asciiDom = IDN.toASCII(dom);
        } catch (IllegalArgumentException e) {
            return INVALID;
        }

        if (containsAny(asciiDom, ",\"'<>\\/ :") || asciiDom.length() <= 2 || asciiDom.indexOf('.') == -1) {
            return INVALID;
        }
        return asciiDom.toLowerCase(Locale.ROOT);
    }

    public static boolean isValid(String email) {
        String addr = unwrap(email);
        if (addr == null || containsAny(addr.substring(0, Math.max(0, addr.lastIndexOf('@'))), " <>,")) {
            return false;
        }
        return !INVALID.equals(extractDomain(addr));
    }

    private static String unwrap(String email) {
        if (email == null) {
            return null;
        }
        String addr = email.trim();
        if (addr.isEmpty()) {
            return null;
        }
        int lt = addr.indexOf('<');
        int gt = addr.indexOf('>');
        if (lt >= 0 && gt > lt) {
            addr = addr.substring(lt + 1, gt).trim();
        }
        if (addr.startsWith("\"") && addr.endsWith("\"") && addr.length() >= 2) {
            addr = addr.substring(1, addr.length() - 1).trim();
        }
        return addr.isEmpty() ? null : addr;
    }

    private static boolean containsAny(String value, String characters) {
        for (int i = 0; i < characters.length(); i++) {
            if (value.indexOf(characters.charAt(i)) != -1) {
                return true;
            }
        }
        return false;
    }
}
