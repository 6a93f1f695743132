package com.yieldoracle.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AddressUtilTest {

    @Test
    void normalize_lowercasesAndTrims() {
        assertThat(AddressUtil.normalize("  0xD9AAEC86B65D86F6A7B5B1B0C42FFA531710B6CA "))
                .isEqualTo("0xd9aaec86b65d86f6a7b5b1b0c42ffa531710b6ca");
    }

    @ParameterizedTest
    @NullSource
    @ValueSource(strings = {"", "d9aaec86b65d86f6a7b5b1b0c42ffa531710b6ca", "0x1234", "0xzzaaec86b65d86f6a7b5b1b0c42ffa531710b6ca"})
    void normalize_rejectsMalformed(String addr) {
        assertThatThrownBy(() -> AddressUtil.normalize(addr)).isInstanceOf(IllegalArgumentException.class);
    }
}
