package com.scholary.mediacache.api;

import jakarta.validation.constraints.NotBlank;

/** Request to move an object to a new key. */
public record RenameRequest(@NotBlank String from, @NotBlank String to) {}
