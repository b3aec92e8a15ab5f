package com.heroes.heroes_api.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class HeroPasswordHasherTest {

    private final HeroPasswordHasher hasher = new HeroPasswordHasher();

    @Test
    void sameInputGivesSameHash() {
        assertThat(hasher.hash("chimichanga")).isEqualTo(hasher.hash("chimichanga"));
    }

    @Test
    void hashDoesNotContainThePassword() {
        String hash = hasher.hash("chimichanga");

        assertThat(hash).doesNotContain("chimichanga").hasSize(64).matches("[0-9a-f]+");
        assertThat(hasher.hash("chimichangas")).isNotEqualTo(hash);
    }

    @Test
    void nullPasswordIsRejected() {
        assertThatThrownBy(() -> hasher.hash(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
