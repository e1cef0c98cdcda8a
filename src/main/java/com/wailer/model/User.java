package com.wailer.model;

/**
 * A user that messages can be addressed to and owned by.
 *
 * <p>Mutable on purpose: tests and applications change a user's name or
 * address after a message was sent to check what is frozen and what is not.
 */
public class User {

    private final Long id;
    private String firstName;
    private String lastName;
    private String email;
    private String phoneNumber;   // free form, parsed to E.164 when used
    private String locale;        // BCP 47 tag, e.g. "fr"

    public User(
            final Long id,
            final String firstName,
            final String lastName,
            final String email,
            final String phoneNumber,
            final String locale) {
        this.id          = id;
        this.firstName   = firstName;
        this.lastName    = lastName;
        this.email       = email;
        this.phoneNumber = phoneNumber;
        this.locale      = locale;
    }

    public Long   getId()          { return id; }
    public String getFirstName()   { return firstName; }
    public String getLastName()    { return lastName; }
    public String getFullName()    { return firstName + " " + lastName; }
    public String getEmail()       { return email; }
    public String getPhoneNumber() { return phoneNumber; }
    public String getLocale()      { return locale; }

    public void setFirstName(final String v)   { this.firstName = v; }
    public void setLastName(final String v)    { this.lastName = v; }
    public void setEmail(final String v)       { this.email = v; }
    public void setPhoneNumber(final String v) { this.phoneNumber = v; }
    public void setLocale(final String v)      { this.locale = v; }

    /** Returns true only if this user has a non-blank email. */
    public boolean hasEmail() {
        return email != null && !email.isBlank();
    }

    @Override
    public String toString() {
        return "User{id=" + id
             + ", email=" + (email != null ? email.replaceAll("(?<=.{3}).(?=.*@)", "*") : "null")
             + ", locale=" + locale + "}";
    }
}
