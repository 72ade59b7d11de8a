package com.redline.core.template;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.redline.core.model.AttackCategory;
import com.redline.core.model.ExpectedBehavior;
import com.redline.core.model.Severity;
import com.redline.core.model.Template;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON authoring format of a template:
 * <pre>
 * { "id", "name", "category", "severity", "description", "template",
 *   "variables": { "NAME": { "type", "default", "choices", "source", "description" } },
 *   "expected_behavior": { "refusal": [...], "compliance": [...] },
 *   "is_active", "is_custom" }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TemplateDocument(
    String id,
    String name,
    String category,
    String severity,
    String description,
    String template,
    Map<String, VariableDocument> variables,
    @JsonProperty("expected_behavior") ExpectedBehavior expectedBehavior,
    @JsonProperty("is_active") Boolean active,
    @JsonProperty("is_custom") Boolean custom
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record VariableDocument(
        String type,
        @JsonProperty("default") String defaultValue,
        List<String> choices,
        String source,
        String description
    ) {}

    /**
     * Converts to a validated {@link Template}.
     *
     * @throws ValidationException on unknown category, severity, variable type, a missing variable
     *         definition or a broken placeholder
     */
    public Template toTemplate() {
        AttackCategory parsedCategory;
        Severity parsedSeverity;
        try {
            parsedCategory = AttackCategory.fromValue(category);
            parsedSeverity = Severity.fromValue(severity);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Template " + id + ": " + e.getMessage());
        }

        var rules = new LinkedHashMap<String, VariableRule>();
        if (variables != null) {
            variables.forEach((placeholder, doc) -> {
                if (doc == null) {
                    throw new ValidationException(placeholder,
                            "Template " + id + ": placeholder " + placeholder + " has no variable definition");
                }
                if (doc.choices() != null && doc.choices().contains(null)) {
                    throw new ValidationException(placeholder,
                            "Template " + id + ": placeholder " + placeholder + " has a null choice");
                }
                rules.put(placeholder, new VariableRule(VariableKind.fromTag(doc.type(), placeholder),
                        doc.defaultValue(), doc.choices(), doc.source(), doc.description()));
            });
        }

        return new Template(id, name != null ? name : id, parsedCategory, parsedSeverity,
                description, template, rules, expectedBehavior,
                active == null || active, custom != null && custom).validate();
    }
}
