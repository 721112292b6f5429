package io.github.hotbrkm.autobulk.dispatcher.recipient;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One addressee of a dispatch cycle. Attributes are opaque to the worker and handed to the template renderer.
 */
public record Recipient(String email, Map<String, String> attributes) {

    public Recipient {
        Objects.requireNonNull(email, "email must not be null");
        email = email.trim();
        Map<String, String> copy = new LinkedHashMap<>();
        if (attributes != null) {
            attributes.forEach((key, value) -> {
                if (key != null && value != null) {
                    copy.put(key, value);
                }
            });
        }
        attributes = Collections.unmodifiableMap(copy);
    }

    public static Recipient of(String email) {
        return new Recipient(email, Map.of());
    }

    public String getDomain() {
        return EmailAddressUtil.extractDomain(email);
    }
}
