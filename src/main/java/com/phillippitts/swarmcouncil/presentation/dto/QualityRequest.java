package com.phillippitts.swarmcouncil.presentation.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request body for {@code POST /api/council/quality}.
 *
 * @param prompt      topic prompt
 * @param keyword     target keyword
 * @param contentType optional; "article" when absent
 */
public record QualityRequest(@NotBlank String prompt, @NotBlank String keyword, String contentType) {}
