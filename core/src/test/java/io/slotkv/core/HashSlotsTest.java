package io.slotkv.core;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class HashSlotsTest {

    @Test
    void crc16_matches_xmodem_check_value() {
        byte[] data = "123456789".getBytes(StandardCharsets.US_ASCII);
        assertEquals(0x31C3, HashSlots.crc16(data, 0, data.length));
    }

    @Test
    void slots_match_well_known_redis_cluster_values() {
        assertEquals(12182, HashSlots.slotFor("foo"));
        assertEquals(5061, HashSlots.slotFor("bar"));
        assertEquals(866, HashSlots.slotFor("hello"));
    }

    @Test
    void slot_is_deterministic_and_in_range() {
        Random rnd = new Random(7);
        for (int i = 0; i < 10_000; i++) {
            byte[] key = new byte[1 + rnd.nextInt(40)];
            rnd.nextBytes(key);
            int a = HashSlots.slotFor(key);
            int b = HashSlots.slotFor(Bytes.of(key));
            assertEquals(a, b);
            assertTrue(a >= 0 && a < HashSlots.SLOT_COUNT, "slot out of range: " + a);
        }
    }

    @Test
    void hash_tag_pins_related_keys_to_one_slot() {
        int expected = HashSlots.slotFor("doc:1");
        assertEquals(expected, HashSlots.slotFor("{doc:1}:meta"));
        assertEquals(expected, HashSlots.slotFor("{doc:1}:line:3"));
    }

    @Test
    void empty_or_unclosed_hash_tag_hashes_whole_key() {
        byte[] emptyTag = "{}doc".getBytes(StandardCharsets.UTF_8);
        assertEquals(HashSlots.crc16(emptyTag, 0, emptyTag.length) % HashSlots.SLOT_COUNT,
                HashSlots.slotFor(emptyTag));

        byte[] unclosed = "{doc".getBytes(StandardCharsets.UTF_8);
        assertEquals(HashSlots.crc16(unclosed, 0, unclosed.length) % HashSlots.SLOT_COUNT,
                HashSlots.slotFor(unclosed));
    }
}
