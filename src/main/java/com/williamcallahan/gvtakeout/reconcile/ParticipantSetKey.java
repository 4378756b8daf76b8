package com.williamcallahan.gvtakeout.reconcile;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Order-independent identity of a group: the sorted, distinct contact ids of its participants.
 *
 * <p>The text form is the ids joined by commas, for example {@code "3,7,12"}.</p>
 *
 * @param contactIds ascending distinct contact ids, never empty
 */
public record ParticipantSetKey(List<Long> contactIds) {

    private static final String SEPARATOR = ",";

    public ParticipantSetKey {
        if (contactIds == null || contactIds.isEmpty()) {
            throw new IllegalArgumentException("A participant set needs at least one contact");
        }
        contactIds = List.copyOf(new TreeSet<>(contactIds));
    }

    public static ParticipantSetKey of(Collection<Long> contactIds) {
        return new ParticipantSetKey(new ArrayList<>(contactIds));
    }

    /**
     * Parses the comma-joined text form.
     *
     * @param key text such as {@code "3,7,12"}; order and duplicates do not matter
     * @return parsed key
     * @throws IllegalArgumentException when the key is empty or holds a non-numeric id
     */
    public static ParticipantSetKey parse(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Group key is required");
        }
        List<Long> ids = new ArrayList<>();
        for (String part : key.split(SEPARATOR, -1)) {
            String trimmed = part.trim();
            try {
                ids.add(Long.parseLong(trimmed));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid contact id '" + trimmed + "' in group key '" + key + "'", e);
            }
        }
        return new ParticipantSetKey(ids);
    }

    public int size() {
        return contactIds.size();
    }

    public boolean contains(long contactId) {
        return contactIds.contains(contactId);
    }

    @JsonValue
    public String value() {
        return contactIds.stream().map(String::valueOf).collect(Collectors.joining(SEPARATOR));
    }

    @Override
    public String toString() {
        return value();
    }
}
