package com.causescore.common;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class HandleParserTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "https://twitter.com/giveth",
            "https://x.com/giveth",
            "http://www.twitter.com/giveth/",
            "x.com/giveth?lang=en",
            "@giveth",
            "giveth"
    })
    void twitterHandle_extractedFromUrlOrBareName(String value) {
        assertThat(HandleParser.twitterHandle(value)).contains("giveth");
    }

    @Test
    void twitterHandle_rejectsForeignHostsAndReservedPaths() {
        assertThat(HandleParser.twitterHandle("https://facebook.com/giveth")).isEmpty();
        assertThat(HandleParser.twitterHandle("https://twitter.com/intent/tweet")).isEmpty();
        assertThat(HandleParser.twitterHandle("https://x.com/")).isEmpty();
        assertThat(HandleParser.twitterHandle("  ")).isEmpty();
        assertThat(HandleParser.twitterHandle(null)).isEmpty();
    }

    @Test
    void farcasterName_lowercasedFromWarpcastUrl() {
        assertThat(HandleParser.farcasterName("https://warpcast.com/Giveth")).contains("giveth");
        assertThat(HandleParser.farcasterName("https://farcaster.xyz/giveth.eth")).contains("giveth.eth");
        assertThat(HandleParser.farcasterName("https://twitter.com/giveth")).isEmpty();
    }

    @Test
    void stripEnsSuffix_removesOnlyTrailingEth() {
        assertThat(HandleParser.stripEnsSuffix("giveth.eth")).isEqualTo("giveth");
        assertThat(HandleParser.stripEnsSuffix("ethereum")).isEqualTo("ethereum");
    }
}
