package com.williamcallahan.gvtakeout.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * A contact with its assigned identifier.
 *
 * @param id stable identifier, unique per {@link ContactIdentity}
 * @param name display name
 * @param phoneNumber phone number, empty when unknown
 */
public record Contact(long id, String name, @JsonProperty("phone_number") String phoneNumber) {

    public Contact {
        Objects.requireNonNull(name, "Contact name must not be null");
        phoneNumber = phoneNumber == null ? "" : phoneNumber;
    }

    @JsonIgnore
    public ContactIdentity identity() {
        return new ContactIdentity(name, phoneNumber);
    }
}
