package com.redline.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.redline.core.model.Template;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON view of a template; variables are listed by placeholder with their kind.
 */
public record TemplateResponse(
    String id,
    String name,
    String category,
    String severity,
    String description,
    String template,
    Map<String, String> variables,
    @JsonProperty("is_active") boolean active,
    @JsonProperty("is_custom") boolean custom
) {

    public static TemplateResponse from(Template template) {
        var variables = new LinkedHashMap<String, String>();
        template.variables().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> variables.put(e.getKey(), e.getValue().kind().tag()));
        return new TemplateResponse(template.id(), template.name(), template.category().value(),
                template.severity().value(), template.description(), template.text(), variables,
                template.active(), template.custom());
    }
}
