package com.redline.dispatch.api;

import com.redline.core.model.AttackCategory;
import com.redline.core.model.Template;
import com.redline.core.template.TemplateDocument;
import com.redline.core.template.TemplateStore;
import com.redline.core.template.ValidationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST controller for browsing attack templates and registering custom ones.
 */
@RestController
@RequestMapping("/api/v1/templates")
public class TemplateController {

    private final TemplateStore templateStore;

    public TemplateController(TemplateStore templateStore) {
        this.templateStore = templateStore;
    }

    /**
     * GET /api/v1/templates: Active templates, optionally of one category.
     */
    @GetMapping
    public ResponseEntity<?> listTemplates(@RequestParam(required = false) String category) {
        List<Template> templates;
        if (category == null || category.isBlank()) {
            templates = templateStore.findAllActive();
        } else {
            try {
                templates = templateStore.findByCategories(Set.of(AttackCategory.fromValue(category)));
            } catch (IllegalArgumentException e) {
                return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
            }
        }
        return ResponseEntity.ok(templates.stream().map(TemplateResponse::from).toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<TemplateResponse> getTemplate(@PathVariable String id) {
        return templateStore.findById(id)
                .map(t -> ResponseEntity.ok(TemplateResponse.from(t)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * POST /api/v1/templates: Register a custom template.
     */
    @PostMapping
    public ResponseEntity<?> registerTemplate(@RequestBody TemplateDocument document) {
        try {
            Template parsed = document.toTemplate();
            Template custom = new Template(parsed.id(), parsed.name(), parsed.category(), parsed.severity(),
                    parsed.description(), parsed.text(), parsed.variables(), parsed.expectedBehavior(),
                    parsed.active(), true);
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(TemplateResponse.from(templateStore.register(custom)));
        } catch (ValidationException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }
}
