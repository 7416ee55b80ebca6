package com.phillippitts.swarmcouncil.presentation.dto;

import jakarta.validation.constraints.NotBlank;

/** Request body for {@code POST /api/council/consult}. */
public record ConsultRequest(@NotBlank String role, @NotBlank String question) {}
