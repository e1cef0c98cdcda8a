package com.wailer.error;

/** A phone number could not be parsed into E.164 form. */
public class InvalidPhoneNumberException extends WailerException {

    private final String input;

    public InvalidPhoneNumberException(final String input, final Throwable cause) {
        super("Invalid phone number: " + input, cause);
        this.input = input;
    }

    public String getInput() { return input; }
}
