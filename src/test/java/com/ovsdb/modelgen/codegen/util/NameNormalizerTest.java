package com.ovsdb.modelgen.codegen.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for NameNormalizer.
 */
class NameNormalizerTest {

    private final NameNormalizer normalizer = NameNormalizer.withDefaultAcronyms();

    @ParameterizedTest
    @CsvSource({
        "foo_bar_baz, FooBarBaz",
        "foo-bar-baz, FooBarBaz",
        "foos-bars-bazs, FoosBarsBazs",
        "ip_port_mappings, IPPortMappings",
        "external_ids, ExternalIDs",
        "ip_prefix, IPPrefix",
        "dns_records, DNSRecords",
        "logical_ip, LogicalIP",
        "ip, IP",
        "Foo_Bar, FooBar",
        "atomicTable, AtomicTable"
    })
    void testNormalize(String input, String expected) {
        assertThat(normalizer.normalize(input)).isEqualTo(expected);
    }

    @Test
    void testEmptyInputYieldsEmptyOutput() {
        assertThat(normalizer.normalize("")).isEmpty();
        assertThat(normalizer.normalize(null)).isEmpty();
    }

    @Test
    void testStraySeparatorsAreDropped() {
        assertThat(normalizer.normalize("_foo__bar_")).isEqualTo("FooBar");
        assertThat(normalizer.normalize("-ip-")).isEqualTo("IP");
        assertThat(normalizer.normalize("__")).isEmpty();
    }

    @Test
    void testFieldName() {
        assertThat(normalizer.fieldName("foo")).isEqualTo("Foo");
    }

    @Test
    void testStructName() {
        assertThat(normalizer.structName("Foo_Bar")).isEqualTo("FooBar");
    }

    @Test
    void testFileName() {
        assertThat(normalizer.fileName("foo")).isEqualTo("Foo.java");
        assertThat(normalizer.fileName("logical_router")).isEqualTo("LogicalRouter.java");
    }

    @Test
    void testDefaultAcronymsAreLoadedFromResource() {
        assertThat(normalizer.getAcronyms()).contains("IP", "ID", "IDs", "UUID", "DNS");
    }

    @Test
    void testAcronymSetIsReadOnly() {
        assertThatThrownBy(() -> normalizer.getAcronyms().add("NAT"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testAdditionalAcronyms() {
        NameNormalizer extended = normalizer.withAdditionalAcronyms(List.of("NAT", "IPv6"));

        assertThat(extended.normalize("nat_addresses")).isEqualTo("NATAddresses");
        assertThat(extended.normalize("ipv6_prefix")).isEqualTo("IPv6Prefix");
        assertThat(extended.normalize("ip")).isEqualTo("IP");
        // original is unchanged
        assertThat(normalizer.normalize("nat_addresses")).isEqualTo("NatAddresses");
    }

    @Test
    void testCustomAcronymsReplaceDefaults() {
        NameNormalizer custom = NameNormalizer.withAcronyms(List.of("MAC"));

        assertThat(custom.normalize("mac_ip")).isEqualTo("MACIp");
    }
}
