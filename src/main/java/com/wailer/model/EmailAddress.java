package com.wailer.model;

import java.util.Objects;
import java.util.Optional;

/** A parsed email address: the addr-spec and an optional display name. */
public final class EmailAddress {

    private final String address;
    private final String displayName;

    public EmailAddress(final String address, final String displayName) {
        this.address     = Objects.requireNonNull(address, "address");
        this.displayName = displayName == null || displayName.isBlank() ? null : displayName;
    }

    public String           getAddress()     { return address; }
    public Optional<String> getDisplayName() { return Optional.ofNullable(displayName); }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof EmailAddress)) return false;
        final EmailAddress that = (EmailAddress) o;
        return address.equals(that.address) && Objects.equals(displayName, that.displayName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(address, displayName);
    }

    @Override
    public String toString() {
        return displayName == null ? address : displayName + " <" + address + ">";
    }
}
