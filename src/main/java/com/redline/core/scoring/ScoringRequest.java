package com.redline.core.scoring;

import com.redline.core.model.AttackCategory;

import java.util.Map;

/**
 * @param category      attack category, selects the corroboration checks
 * @param prompt        prompt that was sent
 * @param response      raw target response; may be null or empty
 * @param plainPayloads plain text behind encoded placeholders, keyed by placeholder
 */
public record ScoringRequest(
    AttackCategory category,
    String prompt,
    String response,
    Map<String, String> plainPayloads
) {

    public ScoringRequest {
        plainPayloads = plainPayloads == null ? Map.of() : Map.copyOf(plainPayloads);
    }
}
