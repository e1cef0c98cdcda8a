package com.wailer.error;

/** An email address could not be parsed while building a provider payload. */
public class InvalidAddressException extends WailerException {

    private final String address;

    public InvalidAddressException(final String address, final Throwable cause) {
        super("Invalid e-mail format: " + address, cause);
        this.address = address;
    }

    public String getAddress() { return address; }
}
