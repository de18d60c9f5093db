package com.platform.relay.network;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class Ipv4CidrTest {

    @Test
    void parseClearsHostBits() {
        Ipv4Cidr cidr = Ipv4Cidr.parse("10.64.3.77/24");

        assertThat(cidr.toString()).isEqualTo("10.64.3.0/24");
        assertThat(cidr.size()).isEqualTo(256);
        assertThat(cidr.address(1)).isEqualTo("10.64.3.1");
        assertThat(cidr.address(255)).isEqualTo("10.64.3.255");
    }

    @Test
    void poolIsCarvedIntoBlocks() {
        Ipv4Cidr pool = Ipv4Cidr.parse("10.64.0.0/10");

        assertThat(pool.blockCount(24)).isEqualTo(16384);
        assertThat(pool.block(0, 24).toString()).isEqualTo("10.64.0.0/24");
        assertThat(pool.block(257, 24).toString()).isEqualTo("10.65.1.0/24");
        assertThat(pool.block(16383, 24).toString()).isEqualTo("10.127.255.0/24");
        assertThatThrownBy(() -> pool.block(16384, 24)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> pool.blockCount(8)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void overlapAndContainment() {
        Ipv4Cidr controlPlane = Ipv4Cidr.parse("172.16.0.0/12");

        assertThat(controlPlane.overlaps(Ipv4Cidr.parse("172.20.5.0/24"))).isTrue();
        assertThat(controlPlane.contains(Ipv4Cidr.parse("172.20.5.0/24"))).isTrue();
        assertThat(controlPlane.overlaps(Ipv4Cidr.parse("172.32.0.0/24"))).isFalse();
        assertThat(Ipv4Cidr.parse("10.0.0.0/8").overlaps(Ipv4Cidr.parse("0.0.0.0/0"))).isTrue();
        assertThat(Ipv4Cidr.parse("10.0.0.0/24").contains(Ipv4Cidr.parse("10.0.0.0/16"))).isFalse();
    }

    @Test
    void malformedInputIsRejected() {
        assertThatThrownBy(() -> Ipv4Cidr.parse("10.0.0.0")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Ipv4Cidr.parse("10.0.0.256/24")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Ipv4Cidr.parse("10.0.0.0/33")).isInstanceOf(IllegalArgumentException.class);
        assertThat(Ipv4Cidr.tryParse("fd00::/64")).isEmpty();
        assertThat(Ipv4Cidr.tryParse("192.168.1.0/24")).contains(Ipv4Cidr.parse("192.168.1.0/24"));
    }
}
