package com.wailer.backend;

import com.wailer.error.InvalidAddressException;
import com.wailer.model.EmailAddress;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;

/**
 * Parses {@code "Name <addr@example.com>"} and bare {@code "addr@example.com"}
 * strings, using Jakarta Mail's RFC 822 parser.
 */
public final class EmailAddresses {

    private EmailAddresses() {}

    /**
     * @throws InvalidAddressException if no address can be extracted
     */
    public static EmailAddress parse(final String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidAddressException(String.valueOf(raw), null);
        }
        try {
            final InternetAddress parsed = new InternetAddress(raw.trim());
            return new EmailAddress(parsed.getAddress(), parsed.getPersonal());
        } catch (AddressException e) {
            throw new InvalidAddressException(raw, e);
        }
    }

    /** Masks the local part for logs: {@code joh***@example.org}. */
    static String mask(final String email) {
        if (email == null) return "null";
        final int at = email.indexOf('@');
        if (at <= 1) return "***";
        return email.substring(0, Math.min(3, at)) + "***" + email.substring(at);
    }

    static String maskPhone(final String phone) {
        if (phone == null || phone.length() < 6) return "***";
        return phone.substring(0, 6) + "***";
    }
}
