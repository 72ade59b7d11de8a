package com.redline.core.template;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.redline.core.config.RedlineProperties;
import com.redline.core.model.Template;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Template store backed by JSON files on the classpath and, optionally, a filesystem
 * directory. Files that fail to parse or validate are logged and skipped.
 */
@Component
public class ClasspathTemplateStore implements TemplateStore {

    private static final Logger log = LoggerFactory.getLogger(ClasspathTemplateStore.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final ConcurrentHashMap<String, Template> templates = new ConcurrentHashMap<>();
    private final String location;
    private final String directory;

    @Autowired
    public ClasspathTemplateStore(RedlineProperties properties) {
        this(properties.getTemplates().getLocation(), properties.getTemplates().getDirectory());
    }

    public ClasspathTemplateStore(String location, String directory) {
        this.location = location;
        this.directory = directory;
    }

    @PostConstruct
    public void load() {
        int loaded = loadClasspath() + loadDirectory();
        log.info("Loaded {} attack template(s) ({} active)", loaded, findAllActive().size());
    }

    @Override
    public Optional<Template> findById(String id) {
        return Optional.ofNullable(templates.get(id));
    }

    @Override
    public List<Template> findAllActive() {
        return templates.values().stream()
                .filter(Template::active)
                .sorted(Comparator.comparing(Template::id))
                .toList();
    }

    @Override
    public Template register(Template template) {
        template.validate();
        templates.put(template.id(), template);
        log.info("Registered template {} [{} / {}]", template.id(), template.category().value(),
                template.severity().value());
        return template;
    }

    public int size() {
        return templates.size();
    }

    private int loadClasspath() {
        if (location == null || location.isBlank()) {
            return 0;
        }
        Resource[] resources;
        try {
            resources = new PathMatchingResourcePatternResolver().getResources(location);
        } catch (IOException e) {
            log.warn("Could not scan template location {}: {}", location, e.getMessage());
            return 0;
        }
        int count = 0;
        for (Resource resource : resources) {
            try (InputStream in = resource.getInputStream()) {
                if (add(mapper.readValue(in, TemplateDocument.class), resource.getDescription())) {
                    count++;
                }
            } catch (IOException e) {
                log.warn("Skipping unreadable template {}: {}", resource.getDescription(), e.getMessage());
            }
        }
        return count;
    }

    private int loadDirectory() {
        if (directory == null || directory.isBlank()) {
            return 0;
        }
        Path root = Path.of(directory);
        if (!Files.isDirectory(root)) {
            log.warn("Template directory {} does not exist", root);
            return 0;
        }
        int count = 0;
        try (Stream<Path> files = Files.walk(root)) {
            for (Path file : files.filter(p -> p.toString().endsWith(".json")).sorted().toList()) {
                try {
                    if (add(mapper.readValue(file.toFile(), TemplateDocument.class), file.toString())) {
                        count++;
                    }
                } catch (IOException e) {
                    log.warn("Skipping unreadable template {}: {}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.warn("Could not walk template directory {}: {}", root, e.getMessage());
        }
        return count;
    }

    private boolean add(TemplateDocument document, String origin) {
        try {
            Template template = document.toTemplate();
            templates.put(template.id(), template);
            return true;
        } catch (ValidationException e) {
            log.warn("Skipping invalid template {}: {}", origin, e.getMessage());
            return false;
        }
    }
}
