package com.redline.dispatch.cli;

import com.redline.core.model.AttackCategory;
import com.redline.core.model.Template;
import com.redline.core.template.TemplateStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.Set;

/**
 * CLI command: redline templates [--category C]
 */
@Command(name = "templates", mixinStandardHelpOptions = true, description = "List active attack templates")
@Component
public class TemplatesCommand implements Runnable {

    @Option(names = {"--category", "-c"}, description = "Only templates of this category")
    private String category;

    private final TemplateStore templateStore;

    public TemplatesCommand(TemplateStore templateStore) {
        this.templateStore = templateStore;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        List<Template> templates;
        try {
            templates = category == null
                    ? templateStore.findAllActive()
                    : templateStore.findByCategories(Set.of(AttackCategory.fromValue(category)));
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }
        for (Template t : templates) {
            System.out.printf("  %-28s %-17s %-9s %s%n", t.id(), t.category().value(),
                    t.severity().value(), t.name());
        }
        ConsoleOutput.info(templates.size() + " template(s)");
    }
}
