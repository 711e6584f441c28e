package com.scholary.livefeed.api;

import jakarta.validation.constraints.PositiveOrZero;

/**
 * Optional body of a chunking start request.
 *
 * @param locator what to extract from; defaults to the stream's playlist or source
 * @param seedOffset offset of the first chunk in seconds; defaults to 0
 */
public record ProcessingStartRequest(String locator, @PositiveOrZero Long seedOffset) {}
