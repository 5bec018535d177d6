package com.aclforge.compiler.port;

import com.aclforge.api.exceptions.UnsupportedFeatureException;
import com.aclforge.api.exceptions.ValidationException;
import com.aclforge.api.model.IpVersion;
import com.aclforge.api.model.PortRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PortProtocolNormalizerTest {

    @Test
    @DisplayName("Should merge overlapping and adjacent ranges")
    void shouldMergeRanges() {
        List<PortRange> merged = PortProtocolNormalizer.mergePorts(List.of(
                PortRange.of(443), PortRange.of(10), PortRange.of(11), PortRange.of(80, 90), PortRange.of(85, 100)));

        assertThat(merged).containsExactly(PortRange.of(10, 11), PortRange.of(80, 100), PortRange.of(443));
    }

    @Test
    @DisplayName("Should merge up to the highest port")
    void shouldMergeAtUpperBound() {
        assertThat(PortProtocolNormalizer.mergePorts(List.of(PortRange.of(1024, 65535), PortRange.of(65535))))
                .containsExactly(PortRange.of(1024, 65535));
    }

    @Test
    @DisplayName("Should close a group before it would exceed the unit budget")
    void shouldConsolidateWithinBudget() {
        List<PortRange> ports = new ArrayList<>();
        for (int port = 1; port <= 13; port++) {
            ports.add(PortRange.of(port * 10));
        }
        ports.add(PortRange.of(1000, 2000));

        List<PortGroup> groups = PortProtocolNormalizer.consolidateForBudget(ports, 14);

        assertThat(groups).hasSize(2);
        assertThat(groups.get(0).ranges()).hasSize(13);
        assertThat(groups.get(0).units()).isEqualTo(13);
        assertThat(groups.get(1).ranges()).containsExactly(PortRange.of(1000, 2000));
        assertThat(groups.get(1).isSingle()).isTrue();
    }

    @Test
    @DisplayName("An entry larger than the budget still gets its own group")
    void oversizedEntryShouldGetOwnGroup() {
        List<PortGroup> groups = PortProtocolNormalizer.consolidateForBudget(
                List.of(PortRange.of(1, 5), PortRange.of(7)), 1);

        assertThat(groups).extracting(PortGroup::ranges)
                .containsExactly(List.of(PortRange.of(1, 5)), List.of(PortRange.of(7)));
    }

    @Test
    @DisplayName("Consolidation matches exactly the original ports for any budget (sampled)")
    void consolidationShouldPreservePorts() {
        Random random = new Random(1234);
        for (int round = 0; round < 200; round++) {
            List<PortRange> ports = new ArrayList<>();
            int count = 1 + random.nextInt(30);
            for (int i = 0; i < count; i++) {
                int low = random.nextInt(PortRange.MAX_PORT + 1);
                int high = random.nextInt(4) == 0 ? Math.min(PortRange.MAX_PORT, low + random.nextInt(500)) : low;
                ports.add(PortRange.of(low, high));
            }
            int budget = 1 + random.nextInt(20);

            List<PortGroup> groups = PortProtocolNormalizer.consolidateForBudget(ports, budget);

            assertThat(PortProtocolNormalizer.groupCoverage(groups).toArray())
                    .as("round %d, budget %d", round, budget)
                    .isEqualTo(PortProtocolNormalizer.coverage(ports).toArray());
            for (PortGroup group : groups) {
                assertThat(group.units() <= budget || group.isSingle()).isTrue();
            }
        }
    }

    @Test
    @DisplayName("Should reject a non-positive budget")
    void shouldRejectNonPositiveBudget() {
        assertThatThrownBy(() -> PortProtocolNormalizer.consolidateForBudget(List.of(PortRange.of(1)), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Protocol tokens follow the target style")
    void shouldMapProtocolTokens() {
        PortProtocolNormalizer byName = PortProtocolNormalizer.byName();
        PortProtocolNormalizer byNumber = new PortProtocolNormalizer(PortProtocolNormalizer.ProtocolStyle.NUMBER, null);

        assertThat(byName.protocolToken("TCP")).isEqualTo("tcp");
        assertThat(byNumber.protocolToken("tcp")).isEqualTo("6");
        assertThat(byNumber.protocolToken("icmpv6")).isEqualTo("58");
        assertThat(byNumber.protocolToken("112")).isEqualTo("112");
        assertThat(byNumber.protocolToken("made-up")).isEqualTo("made-up");
        assertThat(ProtocolTable.nameOf(17)).isEqualTo("udp");
    }

    @Test
    @DisplayName("An allow-list rejects other protocols")
    void allowListShouldRejectUnknownProtocols() {
        PortProtocolNormalizer restricted = new PortProtocolNormalizer(
                PortProtocolNormalizer.ProtocolStyle.NAME, List.of("tcp", "udp", "icmp"));

        assertThat(restricted.protocolToken("udp")).isEqualTo("udp");
        assertThatThrownBy(() -> restricted.protocolToken("gre"))
                .isInstanceOf(UnsupportedFeatureException.class)
                .hasMessageContaining("gre");
    }

    @Test
    @DisplayName("ICMP names resolve per IP version")
    void shouldResolveIcmpTypes() {
        assertThat(PortProtocolNormalizer.normalizeIcmpTypes(
                List.of("echo-request", "echo-reply"), List.of("icmp"), IpVersion.V4).toIntArray())
                .containsExactly(8, 0);
        assertThat(PortProtocolNormalizer.normalizeIcmpTypes(
                List.of("echo-request", "packet-too-big"), List.of("icmpv6"), IpVersion.V6).toIntArray())
                .containsExactly(128, 2);
    }

    @Test
    @DisplayName("No icmp protocol or no names yields the match-all sentinel")
    void shouldReturnSentinel() {
        assertThat(PortProtocolNormalizer.normalizeIcmpTypes(List.of("echo-request"), List.of("tcp"), IpVersion.V4).toIntArray())
                .containsExactly(PortProtocolNormalizer.ANY_ICMP_TYPE);
        assertThat(PortProtocolNormalizer.normalizeIcmpTypes(List.of(), List.of("icmp"), IpVersion.V4).toIntArray())
                .containsExactly(PortProtocolNormalizer.ANY_ICMP_TYPE);
    }

    @Test
    @DisplayName("Unknown names, mixed protocols and wrong families are rejected")
    void shouldRejectInvalidIcmpUse() {
        assertThatThrownBy(() -> PortProtocolNormalizer.normalizeIcmpTypes(
                List.of("packet-too-big"), List.of("icmp"), IpVersion.V4))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("packet-too-big");
        assertThatThrownBy(() -> PortProtocolNormalizer.normalizeIcmpTypes(
                List.of("echo-request"), List.of("icmp", "tcp"), IpVersion.V4))
                .isInstanceOf(UnsupportedFeatureException.class);
        assertThatThrownBy(() -> PortProtocolNormalizer.normalizeIcmpTypes(
                List.of("echo-request"), List.of("icmp"), IpVersion.V6))
                .isInstanceOf(UnsupportedFeatureException.class)
                .hasMessageContaining("IPv6");
    }
}
