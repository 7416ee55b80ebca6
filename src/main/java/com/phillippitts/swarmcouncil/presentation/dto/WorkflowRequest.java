package com.phillippitts.swarmcouncil.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Request body for {@code POST /api/council/workflows}.
 *
 * @param prompt    content prompt
 * @param workflow  full, create, review or optimize
 * @param timeoutMs optional deadline in milliseconds; absent or 0 uses the configured default
 */
public record WorkflowRequest(
        @NotBlank String prompt,
        @NotBlank String workflow,
        @PositiveOrZero Long timeoutMs
) {}
