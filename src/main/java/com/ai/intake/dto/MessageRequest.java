package com.ai.intake.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Patient message. Blank text is allowed; the engine treats it as non-extractable.
 */
public record MessageRequest(@NotNull @Size(max = 4000) String message) {
}
