package de.bsommerfeld.tutoria.core.domain;

import java.util.List;

/**
 * Result of a list query. The whole result set is returned; there is no
 * paging beyond the optional {@code limit} some queries accept.
 */
public record Listing<T>(List<T> items) {

    public Listing {
        items = List.copyOf(items);
    }

    public int totalRecords() {
        return items.size();
    }

    public static <T> Listing<T> empty() {
        return new Listing<>(List.of());
    }
}
