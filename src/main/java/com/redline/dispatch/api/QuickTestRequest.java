package com.redline.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/quick-test.
 *
 * @param templateId template to run
 * @param target     model name; nullable, defaults to the configured target
 * @param variables  placeholder overrides; nullable
 */
public record QuickTestRequest(
    @JsonProperty("template_id") String templateId,
    String target,
    Map<String, String> variables
) {}
