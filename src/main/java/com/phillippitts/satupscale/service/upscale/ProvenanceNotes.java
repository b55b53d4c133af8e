package com.phillippitts.satupscale.service.upscale;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Append-only collector of fallback notes threaded through the fulfillment of one request.
 */
public final class ProvenanceNotes {

    private final List<String> notes = new ArrayList<>();

    public void add(String note) {
        notes.add(Objects.requireNonNull(note, "note"));
    }

    public boolean isEmpty() {
        return notes.isEmpty();
    }

    public List<String> snapshot() {
        return List.copyOf(notes);
    }

    @Override
    public String toString() {
        return notes.toString();
    }
}
