package com.aclforge.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AddressTest {

    @Test
    @DisplayName("Should parse IPv4 CIDR and mask host bits")
    void shouldParseIpv4AndMaskHostBits() {
        Address address = Address.parse("10.1.2.3/8");

        assertThat(address.version()).isEqualTo(IpVersion.V4);
        assertThat(address.prefixLength()).isEqualTo(8);
        assertThat(address.toString()).isEqualTo("10.0.0.0/8");
    }

    @Test
    @DisplayName("Should treat a missing prefix length as a host route")
    void shouldDefaultToHostRoute() {
        assertThat(Address.parse("192.0.2.7").toString()).isEqualTo("192.0.2.7/32");
        assertThat(Address.parse("2001:db8::1").toString()).isEqualTo("2001:db8::1/128");
    }

    @Test
    @DisplayName("Should format IPv6 with the longest zero run compressed")
    void shouldCompressIpv6() {
        assertThat(Address.parse("2001:0db8:0000:0000:0000:0000:0000:0000/32").toString())
                .isEqualTo("2001:db8::/32");
        assertThat(Address.parse("::/0").toString()).isEqualTo("::/0");
        assertThat(Address.parse("2001:db8:0:1:0:0:0:1").toString()).isEqualTo("2001:db8:0:1::1/128");
    }

    @Test
    @DisplayName("Should reject malformed addresses and out-of-range prefix lengths")
    void shouldRejectMalformedInput() {
        assertThatThrownBy(() -> Address.parse("10.0.0/8"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid IPv4 address");
        assertThatThrownBy(() -> Address.parse("10.0.0.256/8"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Address.parse("10.0.0.0/33"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("out of range");
        assertThatThrownBy(() -> Address.parse("10.0.0.0/x"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid prefix length");
    }

    @Test
    @DisplayName("Containment is CIDR containment within one IP version")
    void shouldComputeContainment() {
        Address wide = Address.parse("10.0.0.0/8");
        Address narrow = Address.parse("10.20.0.0/16");
        Address other = Address.parse("11.0.0.0/8");

        assertThat(wide.contains(narrow)).isTrue();
        assertThat(narrow.contains(wide)).isFalse();
        assertThat(wide.contains(wide)).isTrue();
        assertThat(wide.overlaps(narrow)).isTrue();
        assertThat(wide.overlaps(other)).isFalse();
        assertThat(IpVersion.V4.anyAddress().contains(Address.parse("2001:db8::/32"))).isFalse();
        assertThat(wide.contains(IpVersion.V4, BigInteger.valueOf(0x0A7F0001L))).isTrue();
        assertThat(wide.contains(IpVersion.V6, BigInteger.valueOf(0x0A7F0001L))).isFalse();
    }

    @Test
    @DisplayName("Equality ignores token and comment")
    void equalityShouldIgnoreAnnotations() {
        Address plain = Address.parse("10.0.0.0/8");
        Address annotated = Address.parse("10.0.0.0/8", "RFC1918", "private space");

        assertThat(annotated).isEqualTo(plain);
        assertThat(annotated.hashCode()).isEqualTo(plain.hashCode());
        assertThat(annotated.token()).isEqualTo("RFC1918");
        assertThat(annotated.comment()).isEqualTo("private space");
    }

    @Test
    @DisplayName("Should order by version, then network, then prefix length")
    void shouldOrderDeterministically() {
        Address v6 = Address.parse("::/0");
        Address a = Address.parse("10.0.0.0/8");
        Address b = Address.parse("10.0.0.0/16");
        Address c = Address.parse("9.0.0.0/8");

        assertThat(java.util.stream.Stream.of(v6, b, a, c).sorted().toList())
                .containsExactly(c, a, b, v6);
    }

    @Test
    @DisplayName("First and last address span the prefix")
    void shouldExposeBounds() {
        Address address = Address.parse("192.168.1.0/24");

        assertThat(address.networkText()).isEqualTo("192.168.1.0");
        assertThat(address.firstAddress()).isEqualTo(BigInteger.valueOf(0xC0A80100L));
        assertThat(address.lastAddress()).isEqualTo(BigInteger.valueOf(0xC0A801FFL));
        assertThat(IpVersion.V4.anyAddress().isAny()).isTrue();
    }
}
