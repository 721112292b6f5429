package io.github.hotbrkm.autobulk.dispatcher.recipient;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EmailAddressUtil test")
class EmailAddressUtilTest {

    @Test
    @DisplayName("Domain is extracted lower-cased, including display-name forms")
    void extractDomain_normalizes() {
        assertThat(EmailAddressUtil.extractDomain("User@Example.COM")).isEqualTo("example.com");
        assertThat(EmailAddressUtil.extractDomain("Kim <kim@mail.example.org>")).isEqualTo("mail.example.org");
        assertThat(EmailAddressUtil.extractDomain("dot@example.com.")).isEqualTo("example.com");
    }

    @Test
    @DisplayName("Malformed addresses map to INVALID")
    void extractDomain_invalid() {
        assertThat(EmailAddressUtil.extractDomain(null)).isEqualTo(EmailAddressUtil.INVALID);
        assertThat(EmailAddressUtil.extractDomain("")).isEqualTo(EmailAddressUtil.INVALID);
        assertThat(EmailAddressUtil.extractDomain("no-at-sign")).isEqualTo(EmailAddressUtil.INVALID);
        assertThat(EmailAddressUtil.extractDomain("@example.com")).isEqualTo(EmailAddressUtil.INVALID);
        assertThat(EmailAddressUtil.extractDomain("user@localhost")).isEqualTo(EmailAddressUtil.INVALID);
        assertThat(EmailAddressUtil.extractDomain("user@[127.0.0.1]")).isEqualTo(EmailAddressUtil.INVALID);
    }

    @Test
    @DisplayName("isValid rejects spaces in the local part")
    void isValid_checksLocalPart() {
        assertThat(EmailAddressUtil.isValid("ops@example.com")).isTrue();
        assertThat(EmailAddressUtil.isValid("two words@example.com")).isFalse();
        assertThat(EmailAddressUtil.isValid("ops@")).isFalse();
    }
}
