package com.heroes.heroes_api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Request body for creating a hero. The plain password is only used to derive
 * the stored hash.
 */
public record HeroCreate(
        @NotBlank String name,
        @PositiveOrZero Integer age,
        Long teamId,
        @NotBlank String secretName,
        @NotBlank String password) {
}
