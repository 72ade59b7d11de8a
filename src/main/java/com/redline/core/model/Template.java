package com.redline.core.model;

import com.redline.core.template.Placeholders;
import com.redline.core.template.ValidationException;
import com.redline.core.template.VariableRule;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable, reusable attack definition with named {@code {{PLACEHOLDER}}} markers.
 *
 * @param id               template identifier
 * @param name             display name
 * @param category         attack category
 * @param severity         severity inherited by attacks built from this template
 * @param description      free text; nullable
 * @param text             raw prompt text containing placeholders
 * @param variables        rule for every placeholder, keyed by placeholder name
 * @param expectedBehavior refusal / compliance exemplars
 * @param active           inactive templates are never selected for campaigns
 * @param custom           user-authored rather than built in
 */
public record Template(
    String id,
    String name,
    AttackCategory category,
    Severity severity,
    String description,
    String text,
    Map<String, VariableRule> variables,
    ExpectedBehavior expectedBehavior,
    boolean active,
    boolean custom
) {

    public Template {
        variables = variables == null ? Map.of() : Map.copyOf(new LinkedHashMap<>(variables));
        expectedBehavior = expectedBehavior == null ? ExpectedBehavior.NONE : expectedBehavior;
    }

    public Set<String> placeholders() {
        return Placeholders.find(text);
    }

    /**
     * Checks the structural invariants: identity fields are present and every placeholder
     * in the text has a variable rule.
     *
     * @throws ValidationException on the first violation found
     */
    public Template validate() {
        if (id == null || id.isBlank()) {
            throw new ValidationException("Template id is required");
        }
        if (category == null || severity == null) {
            throw new ValidationException("Template " + id + " must declare category and severity");
        }
        if (text == null || text.isBlank()) {
            throw new ValidationException("Template " + id + " has no prompt text");
        }
        for (String placeholder : placeholders()) {
            if (!variables.containsKey(placeholder)) {
                throw new ValidationException(placeholder,
                        "Template " + id + " references undeclared placeholder {{" + placeholder + "}}");
            }
        }
        variables.forEach((name, rule) -> rule.validate(name));
        return this;
    }
}
