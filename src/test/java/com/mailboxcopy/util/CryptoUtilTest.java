package com.mailboxcopy.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * CryptoUtil unit tests
 */
class CryptoUtilTest {

    @Test
    @DisplayName("Create SHA-256 hash")
    void testSha256() {
        String hash = CryptoUtil.sha256("abc");

        assertThat(hash).hasSize(64); // SHA-256 is 64 hex characters
        assertThat(hash).isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
        assertThat(CryptoUtil.sha256("abd")).isNotEqualTo(hash);
    }
}
