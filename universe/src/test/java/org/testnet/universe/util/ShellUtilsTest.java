package org.testnet.universe.util;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ShellUtilsTest {

    @Test
    public void quote() {
        assertThat(ShellUtils.quote("plain")).isEqualTo("'plain'");
        assertThat(ShellUtils.quote("it's")).isEqualTo("'it'\\''s'");
        assertThat(ShellUtils.quoteAll(ImmutableList.of("a b", "$HOME"))).isEqualTo("'a b' '$HOME'");
    }
}
