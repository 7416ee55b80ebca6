package com.phillippitts.swarmcouncil.presentation.dto;

/** Answer of a single council member. */
public record ConsultResponse(String role, String answer) {}
