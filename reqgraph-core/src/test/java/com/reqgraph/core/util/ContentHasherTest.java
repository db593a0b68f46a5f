package com.reqgraph.core.util;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ContentHasherTest {

    @Test
    void hash_ignoresMapInsertionOrder() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("title", "Login");
        first.put("priority", "high");
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("priority", "high");
        second.put("title", "Login");

        assertThat(ContentHasher.hash(first)).isEqualTo(ContentHasher.hash(second));
    }

    @Test
    void hash_differsWhenContentDiffers() {
        assertThat(ContentHasher.hash(Map.of("title", "Login")))
            .isNotEqualTo(ContentHasher.hash(Map.of("title", "Logout")));
    }

    @Test
    void hash_isSixteenLowercaseHexCharacters() {
        assertThat(ContentHasher.hash(Map.of("implements", List.of("FR-001"))))
            .hasSize(16)
            .matches("[0-9a-f]{16}");
    }
}
