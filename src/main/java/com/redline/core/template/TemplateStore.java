package com.redline.core.template;

import com.redline.core.model.AttackCategory;
import com.redline.core.model.Template;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read access to attack templates, plus registration of custom ones.
 */
public interface TemplateStore {

    Optional<Template> findById(String id);

    List<Template> findAllActive();

    /** Active templates whose category is in {@code categories}. */
    default List<Template> findByCategories(Set<AttackCategory> categories) {
        return findAllActive().stream()
                .filter(t -> categories.contains(t.category()))
                .toList();
    }

    /**
     * Adds or replaces a template after validating it.
     *
     * @throws ValidationException if the template is malformed
     */
    Template register(Template template);
}
