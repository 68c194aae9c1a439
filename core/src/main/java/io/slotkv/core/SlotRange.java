// file: core/src/main/java/io/slotkv/core/SlotRange.java
package io.slotkv.core;

/**
 * Closed interval [startSlot, endSlot] over the hash slot space.
 * <p>
 * Unlike a token ring there is no wrap-around: the slot space is a flat
 * array 0..SLOT_COUNT-1 and shards cover it with contiguous, disjoint ranges.
 */
public record SlotRange(int startSlot, int endSlot) implements Comparable<SlotRange> {

    public SlotRange {
        if (startSlot < 0 || endSlot >= HashSlots.SLOT_COUNT) {
            throw new IllegalArgumentException(
                    "slot range [%d, %d] outside 0..%d".formatted(startSlot, endSlot, HashSlots.SLOT_COUNT - 1));
        }
        if (startSlot > endSlot) {
            throw new IllegalArgumentException("startSlot must be <= endSlot: " + startSlot + " > " + endSlot);
        }
    }

    public boolean contains(int slot) {
        return slot >= startSlot && slot <= endSlot;
    }

    public boolean overlaps(SlotRange other) {
        return startSlot <= other.endSlot && other.startSlot <= endSlot;
    }

    public int size() {
        return endSlot - startSlot + 1;
    }

    @Override
    public int compareTo(SlotRange o) {
        return Integer.compare(startSlot, o.startSlot);
    }

    @Override
    public String toString() {
        return "SlotRange[" + startSlot + "," + endSlot + "]";
    }
}
