package com.trustboundary.infrastructure.crypto;

import com.trustboundary.domain.model.Seal;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;

class CanonicalJsonTest {

    private final CanonicalJson json = new CanonicalJson();

    @Test
    void mapKeysAreSortedAndNullsOmitted() {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("zeta", 1);
        value.put("alpha", null);
        value.put("mid", Instant.parse("2024-03-01T12:00:00Z"));

        assertEquals("{\"mid\":\"2024-03-01T12:00:00Z\",\"zeta\":1}", json.write(value));
    }

    @Test
    void beanPropertiesAreSorted() {
        Seal seal = Seal.builder().sealId("s1").signature("sig").data("payload").build();

        assertEquals("{\"data\":\"payload\",\"sealId\":\"s1\",\"signature\":\"sig\"}", json.write(seal));
    }

    @Test
    void copyIsDetached() {
        Seal seal = Seal.builder().sealId("s1").data("payload").build();

        Seal copy = json.copy(seal, Seal.class);

        assertNotSame(seal, copy);
        assertEquals(seal, copy);
    }

    @Test
    void toMapRendersPropertiesByName() {
        Map<String, Object> map = json.toMap(Seal.builder().sealId("s1").data("payload").build());

        assertEquals(Map.of("sealId", "s1", "data", "payload"), map);
        assertEquals(LinkedHashMap.class, map.getClass());
    }
}
