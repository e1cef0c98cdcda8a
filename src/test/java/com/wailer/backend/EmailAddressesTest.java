package com.wailer.backend;

import com.wailer.error.InvalidAddressException;
import com.wailer.model.EmailAddress;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class EmailAddressesTest {

    @Test
    void parse_bareAddress() {
        final EmailAddress address = EmailAddresses.parse("foo@bar.com");

        assertThat(address.getAddress()).isEqualTo("foo@bar.com");
        assertThat(address.getDisplayName()).isEmpty();
    }

    @Test
    void parse_nameAndAddress() {
        final EmailAddress address = EmailAddresses.parse("Foo <foo@bar.com>");

        assertThat(address.getAddress()).isEqualTo("foo@bar.com");
        assertThat(address.getDisplayName()).contains("Foo");
    }

    @Test
    void parse_garbage_throws() {
        assertThatThrownBy(() -> EmailAddresses.parse("<<<"))
                .isInstanceOf(InvalidAddressException.class)
                .satisfies(e -> assertThat(((InvalidAddressException) e).getAddress()).isEqualTo("<<<"));
    }

    @Test
    void parse_blank_throws() {
        assertThatThrownBy(() -> EmailAddresses.parse(" "))
                .isInstanceOf(InvalidAddressException.class);
    }

    @Test
    void mask_hidesLocalPart() {
        assertThat(EmailAddresses.mask("john.doe@example.org")).isEqualTo("joh***@example.org");
        assertThat(EmailAddresses.maskPhone("+33612345678")).isEqualTo("+33612***");
    }
}
