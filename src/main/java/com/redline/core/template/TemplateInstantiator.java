package com.redline.core.template;

import com.redline.core.model.Template;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns a {@link Template} plus caller overrides into a concrete attack prompt.
 * <p>
 * Each placeholder is resolved once per instantiation, so repeated occurrences of the
 * same placeholder receive the same value. Substitution is a single pass.
 */
@Service
public class TemplateInstantiator {

    private static final Logger log = LoggerFactory.getLogger(TemplateInstantiator.class);

    private final VariableProcessor processor;

    public TemplateInstantiator() {
        this(new VariableProcessor());
    }

    public TemplateInstantiator(VariableProcessor processor) {
        this.processor = processor;
    }

    /**
     * @param template  template to instantiate
     * @param overrides placeholder name to value; nullable
     * @throws TemplateException   if the text references an undeclared placeholder
     * @throws ValidationException if a rule cannot produce a value
     */
    public InstantiatedPrompt instantiate(Template template, Map<String, String> overrides) {
        Map<String, String> provided = overrides != null ? overrides : Map.of();
        var values = new LinkedHashMap<String, String>();
        var payloads = new LinkedHashMap<String, String>();

        for (String placeholder : template.placeholders()) {
            VariableRule rule = template.variables().get(placeholder);
            if (rule == null) {
                throw new TemplateException("Template " + template.id()
                        + " references undeclared placeholder {{" + placeholder + "}}");
            }
            String override = provided.get(placeholder);
            values.put(placeholder, processor.resolve(placeholder, rule, override));
            String plain = processor.plainPayload(rule, override);
            if (plain != null && !plain.isEmpty()) {
                payloads.put(placeholder, plain);
            }
        }

        String prompt = Placeholders.substitute(template.text(), values::get);
        log.debug("Instantiated template {} with {} placeholder(s)", template.id(), values.size());
        return new InstantiatedPrompt(template.id(), prompt, values, payloads);
    }
}
