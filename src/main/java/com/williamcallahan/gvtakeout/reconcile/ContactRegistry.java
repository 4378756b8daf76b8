package com.williamcallahan.gvtakeout.reconcile;

import com.williamcallahan.gvtakeout.model.Contact;
import com.williamcallahan.gvtakeout.model.ContactIdentity;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns contact ids in first-seen order, one per distinct (name, phone number) pair.
 *
 * <p>Not thread-safe.</p>
 */
public final class ContactRegistry {

    private final Map<ContactIdentity, Contact> contacts = new LinkedHashMap<>();

    /**
     * Returns the contact for {@code identity}, registering it with the next id if it is new.
     */
    public Contact register(ContactIdentity identity) {
        return contacts.computeIfAbsent(identity,
                key -> new Contact(contacts.size() + 1L, key.name(), key.phoneNumber()));
    }

    public List<Contact> contacts() {
        return List.copyOf(new ArrayList<>(contacts.values()));
    }
}
