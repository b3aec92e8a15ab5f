package com.heroes.heroes_api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request body for creating a team.
 */
public record TeamCreate(@NotBlank String name, @NotBlank String headquarters) {
}
