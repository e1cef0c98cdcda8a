package com.wailer.render;

import com.google.i18n.phonenumbers.NumberParseException;
import com.google.i18n.phonenumbers.PhoneNumberUtil;
import com.google.i18n.phonenumbers.Phonenumber.PhoneNumber;
import com.wailer.error.InvalidPhoneNumberException;

import java.util.List;
import java.util.Optional;

/**
 * Phone number parsing and formatting, backed by libphonenumber.
 *
 * <p>Numbers are parsed without a default region, so they must be written in
 * international form ({@code +33 6 12 34 56 78}). The canonical form kept in
 * messages and sent to providers is E.164 ({@code +33612345678}).
 */
public final class PhoneNumbers {

    private static final PhoneNumberUtil UTIL = PhoneNumberUtil.getInstance();

    private PhoneNumbers() {}

    /**
     * @return the number in E.164 form
     * @throws InvalidPhoneNumberException if it cannot be parsed or is not a valid number
     */
    public static String parse(final String input) {
        return UTIL.format(parseNumber(input), PhoneNumberUtil.PhoneNumberFormat.E164);
    }

    public static int countryCode(final String input) {
        return parseNumber(input).getCountryCode();
    }

    /** First sender whose country calling code matches the recipient's. */
    public static Optional<String> senderFor(final String recipient, final List<String> senders) {
        final int target = countryCode(recipient);
        for (final String sender : senders) {
            final PhoneNumber number = parseNumber(sender);
            if (number.getCountryCode() == target) {
                return Optional.of(UTIL.format(number, PhoneNumberUtil.PhoneNumberFormat.E164));
            }
        }
        return Optional.empty();
    }

    private static PhoneNumber parseNumber(final String input) {
        if (input == null || input.isBlank()) {
            throw new InvalidPhoneNumberException(String.valueOf(input), null);
        }
        try {
            final PhoneNumber number = UTIL.parse(input, null);
            if (!UTIL.isValidNumber(number)) {
                throw new InvalidPhoneNumberException(input, null);
            }
            return number;
        } catch (NumberParseException e) {
            throw new InvalidPhoneNumberException(input, e);
        }
    }
}
