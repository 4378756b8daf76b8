package com.williamcallahan.gvtakeout.model;

import java.util.Objects;

/**
 * Natural key of a contact: the exact (name, phone number) pair.
 *
 * <p>An empty phone number is a value of its own, so two people sharing a name stay distinct
 * when only one of them has a known number.</p>
 *
 * @param name display name
 * @param phoneNumber phone number, empty when unknown
 */
public record ContactIdentity(String name, String phoneNumber) {

    public ContactIdentity {
        Objects.requireNonNull(name, "Contact name must not be null");
        phoneNumber = phoneNumber == null ? "" : phoneNumber;
    }
}
