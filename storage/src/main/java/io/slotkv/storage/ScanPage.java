package io.slotkv.storage;

import io.slotkv.core.Bytes;

import java.util.List;

/**
 * One step of a cursor iteration.
 *
 * @param cursor cursor for the next call; 0 when the iteration is complete
 * @param items  elements of this page that passed the filter
 */
public record ScanPage(long cursor, List<Bytes> items) {

    public ScanPage {
        items = List.copyOf(items);
    }
}
