package com.redline.core.template;

import java.util.Map;

/**
 * Result of instantiating a template.
 *
 * @param templateId     source template
 * @param prompt         concrete prompt text
 * @param variableValues value substituted for every placeholder
 * @param plainPayloads  for encoded placeholders, the text before encoding
 */
public record InstantiatedPrompt(
    String templateId,
    String prompt,
    Map<String, String> variableValues,
    Map<String, String> plainPayloads
) {

    public InstantiatedPrompt {
        variableValues = Map.copyOf(variableValues);
        plainPayloads = Map.copyOf(plainPayloads);
    }
}
