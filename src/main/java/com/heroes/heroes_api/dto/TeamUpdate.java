package com.heroes.heroes_api.dto;

import jakarta.validation.constraints.Size;

/**
 * Partial update of a team. A null field means "leave unchanged".
 */
public record TeamUpdate(@Size(min = 1) String name, @Size(min = 1) String headquarters) {
}
