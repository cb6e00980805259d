package com.cornerleague.collector.service.extract;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ContentHasherTest {

    private final ContentHasher hasher = new ContentHasher();

    @Test
    void contentHash_ignoresCaseWhitespaceAndPunctuation() {
        String a = hasher.contentHash("Chiefs Win!", "Mahomes threw three touchdowns in the fourth quarter.");
        String b = hasher.contentHash("chiefs   win", "MAHOMES threw three touchdowns, in the fourth quarter");

        assertThat(a).isEqualTo(b).hasSize(64);
    }

    @Test
    void contentHash_differsWhenTextDiffers() {
        String a = hasher.contentHash("Chiefs win", "Mahomes threw three touchdowns");
        String b = hasher.contentHash("Chiefs win", "Mahomes threw four touchdowns");

        assertThat(a).isNotEqualTo(b);
    }
}
