package org.testnet.universe.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AddressUtilsTest {

    @Test
    public void wellFormedEndpoints() {
        assertThat(AddressUtils.isWellFormedEndpoint("10.0.0.1:8001")).isTrue();
        assertThat(AddressUtils.isWellFormedEndpoint("node-1.testnet.example.com:8899")).isTrue();
        assertThat(AddressUtils.isWellFormedEndpoint("[2001:db8::1]:8001")).isTrue();
    }

    @Test
    public void malformedEndpoints() {
        assertThat(AddressUtils.isWellFormedEndpoint(null)).isFalse();
        assertThat(AddressUtils.isWellFormedEndpoint("")).isFalse();
        assertThat(AddressUtils.isWellFormedEndpoint("10.0.0.1")).isFalse();
        assertThat(AddressUtils.isWellFormedEndpoint("10.0.0.1:0")).isFalse();
        assertThat(AddressUtils.isWellFormedEndpoint("10.0.0.1:70000")).isFalse();
        assertThat(AddressUtils.isWellFormedEndpoint("0.0.0.0:8001")).isFalse();
        assertThat(AddressUtils.isWellFormedEndpoint("[::]:8001")).isFalse();
        assertThat(AddressUtils.isWellFormedEndpoint("not an address:8001")).isFalse();
    }

    @Test
    public void endpointBracketsIpv6() {
        assertThat(AddressUtils.endpoint("10.0.0.1", 8001)).isEqualTo("10.0.0.1:8001");
        assertThat(AddressUtils.endpoint("2001:db8::1", 8001)).isEqualTo("[2001:db8::1]:8001");
    }
}
