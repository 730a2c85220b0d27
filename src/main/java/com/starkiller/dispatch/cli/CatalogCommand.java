package com.starkiller.dispatch.cli;

import com.starkiller.core.content.ContentCatalog;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: starkiller catalog
 * <p>
 * Summarizes the loaded content catalog.
 */
@Command(name = "catalog", mixinStandardHelpOptions = true, description = "Show the loaded content catalog")
@Component
public class CatalogCommand implements Runnable {

    private final ContentCatalog catalog;

    public CatalogCommand(ContentCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        System.out.println();
        System.out.printf("  %-14s %-28s %s%n", "CATEGORY", "FACTIONS", "CODE PREFIXES");
        System.out.println("  " + "-".repeat(64));
        for (var category : catalog.categories()) {
            System.out.printf("  %-14s %-28s %s%n",
                    category.categoryName(),
                    String.join(", ", category.associatedFactions()),
                    String.join(", ", category.validAccessCodePrefixes()));
        }

        System.out.println();
        ConsoleOutput.info("Ship types: " + catalog.shipTypes().size());
        ConsoleOutput.info("Captain types: " + catalog.captainTypes().size());
        ConsoleOutput.info("Story scenarios: " + catalog.scenarios().size());
        ConsoleOutput.info("Manifests: " + catalog.manifests().size());
        ConsoleOutput.info("Access codes: " + catalog.accessCodes().size());
        ConsoleOutput.info("Day rules: " + catalog.dayRules().size());
    }
}
