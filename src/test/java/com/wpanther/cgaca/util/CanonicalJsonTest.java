package com.wpanther.cgaca.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for CanonicalJson
 */
class CanonicalJsonTest {

    private final CanonicalJson canonicalJson = new CanonicalJson();

    @Test
    void testWrite_SortsKeysAtEveryDepth() {
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("zeta", 1);
        nested.put("alpha", 2);
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("policies", Arrays.asList("b", "a"));
        value.put("killSwitch", nested);
        value.put("agent", "agent-7");

        assertThat(canonicalJson.write(value))
                .isEqualTo("{\"agent\":\"agent-7\",\"killSwitch\":{\"alpha\":2,\"zeta\":1},\"policies\":[\"b\",\"a\"]}");
    }

    @Test
    void testWrite_IgnoresOrderOfSortedMaps() {
        Map<String, Object> reversed = new TreeMap<>(Comparator.reverseOrder());
        reversed.put("a", 1);
        reversed.put("b", 2);

        assertThat(canonicalJson.write(reversed)).isEqualTo("{\"a\":1,\"b\":2}");
    }

    @Test
    void testWrite_OmitsNullsAndWritesInstantsAsText() {
        Map<String, Object> value = new HashMap<>();
        value.put("issuedAt", Instant.parse("2026-03-01T12:00:00Z"));
        value.put("previousCertificateId", null);

        assertThat(canonicalJson.write(value)).isEqualTo("{\"issuedAt\":\"2026-03-01T12:00:00Z\"}");
    }

    @Test
    void testSha256Hex_SameContentSameHash() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("riskLevel", "limited");
        first.put("maxBudgetUsd", 250);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("maxBudgetUsd", 250);
        second.put("riskLevel", "limited");

        assertThat(canonicalJson.sha256Hex(first))
                .isEqualTo(canonicalJson.sha256Hex(second))
                .hasSize(64)
                .matches("[0-9a-f]+");
        assertThat(canonicalJson.sha256Hex(canonicalJson.readTree(canonicalJson.write(first))))
                .isEqualTo(canonicalJson.sha256Hex(first));
    }

    @Test
    void testWrite_FractionalNumbersHaveOneForm() {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("budget", new BigDecimal("250.10"));
        value.put("rate", 0.5d);
        value.put("whole", new BigDecimal("100.00"));

        assertThat(canonicalJson.write(value)).isEqualTo("{\"budget\":250.1,\"rate\":0.5,\"whole\":100}");
    }

    @Test
    void testSha256Hex_DecimalsHashTheSameAfterReparsing() {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("maxBudgetUsd", new BigDecimal("1.10"));
        value.put("threshold", new BigDecimal("0.12345678901234567890123"));

        assertThat(canonicalJson.sha256Hex(canonicalJson.readTree(canonicalJson.write(value))))
                .isEqualTo(canonicalJson.sha256Hex(value));
    }

    @Test
    void testSha256Hex_KnownVector() {
        assertThat(CanonicalJson.sha256Hex(new byte[0]))
                .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
    }

    @Test
    void testReadTree_RejectsMalformedJson() {
        assertThatThrownBy(() -> canonicalJson.readTree("{\"unterminated\":"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
