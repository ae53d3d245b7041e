/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.transform;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RawRecordCopierTest {

    @Test
    @SuppressWarnings("unchecked")
    void nestedContainersAreCopied() {
        List<Object> tags = new ArrayList<>(List.of("a"));
        Map<String, Object> inner = new HashMap<>(Map.of("tags", tags));
        Map<String, Object> item = new HashMap<>(Map.of("inner", inner, "n", 1));

        Map<String, Object> copy = RawRecordCopier.copyRecord(item);
        ((List<Object>) ((Map<String, Object>) copy.get("inner")).get("tags")).add("b");

        assertEquals(List.of("a"), tags);
        assertEquals(item.get("n"), copy.get("n"));
        assertNotSame(inner, copy.get("inner"));
    }

    @Test
    void sharedButAcyclicReferencesAreAllowed() {
        Map<String, Object> shared = new HashMap<>(Map.of("k", "v"));
        Map<String, Object> item = new HashMap<>();
        item.put("left", shared);
        item.put("right", shared);

        Map<String, Object> copy = RawRecordCopier.copyRecord(item);

        assertEquals(copy.get("left"), copy.get("right"));
    }

    @Test
    void cyclesAndUnknownTypesAreRejected() {
        List<Object> loop = new ArrayList<>();
        loop.add(loop);
        Map<String, Object> cyclic = new HashMap<>(Map.of("loop", loop));

        assertThrows(IllegalArgumentException.class, () -> RawRecordCopier.copyRecord(cyclic));
        assertThrows(IllegalArgumentException.class,
                () -> RawRecordCopier.copyRecord(new HashMap<String, Object>(Map.of("bytes", new byte[] {1}))));
    }
}
