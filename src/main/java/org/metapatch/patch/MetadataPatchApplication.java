package org.metapatch.patch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main Spring Boot application for patching metadata documents
 */
@SpringBootApplication
@EnableConfigurationProperties
public class MetadataPatchApplication {

    public static void main(String[] args) {
        // Check for help argument before starting Spring
        if (args.length == 0 || args[0].equals("--help") || args[0].equals("-h")) {
            printUsage();
            System.exit(args.length == 0 ? 2 : 0);
        }

        SpringApplication app = new SpringApplication(MetadataPatchApplication.class);
        System.exit(SpringApplication.exit(app.run(args)));
    }

    /**
     * Prints usage information
     */
    static void printUsage() {
        System.out.println("\nMetadata Patcher");
        System.out.println("Usage: java -jar metadata-patcher.jar <operation> <document> \"<value>[;;<value>...]\" [OPTIONS]");
        System.out.println("\nData composition schema operations (--target = dataset or settings variant):");
        System.out.println("  add-field, add-total, add-calculated-field, add-parameter, add-filter, add-order,");
        System.out.println("  add-selection, add-link, add-dataset, add-variant, add-conditional-appearance,");
        System.out.println("  remove-field, remove-total, remove-calculated-field, remove-parameter, remove-filter,");
        System.out.println("  remove-order, remove-selection, remove-dataset, remove-variant,");
        System.out.println("  set-query, set-expression, clear-selection, clear-filter, clear-order");
        System.out.println("\nForm operations (--target = table):");
        System.out.println("  add-column, remove-column");
        System.out.println("\nRole operations:");
        System.out.println("  add-right, remove-right");
        System.out.println("\nConfiguration operations:");
        System.out.println("  add-object, remove-object");
        System.out.println("\nOptions:");
        System.out.println("  --target=NAME                              Dataset, variant or table to edit");
        System.out.println("  --no-cascade                               Do not update dependent lists");
        System.out.println("  --patch.default-language=en                Language of plain titles");
        System.out.println("  --patch.batch-separator=;;                 Separator between batch entries");
        System.out.println("  --patch.report.generate-json=true          Write a JSON report");
        System.out.println("  --patch.report.generate-junit=true         Write a JUnit XML report");
        System.out.println("  -h, --help                                 Show this help message");
        System.out.println("\nExamples:");
        System.out.println("  java -jar metadata-patcher.jar add-field Template.xml \\");
        System.out.println("    \"Total: decimal(15,2) [Total Amount] @measure;;Customer: CatalogRef.Customers\"");
        System.out.println("");
        System.out.println("  java -jar metadata-patcher.jar add-filter Template.xml \"Status = Active @user\" --target=Main");
        System.out.println("");
        System.out.println("  java -jar metadata-patcher.jar add-right Rights.xml \"Catalog.Products: Read View !Delete\"");
        System.out.println("");
        System.out.println("Exit status: 0 when every entry completed, 1 on a missing target or I/O failure,");
        System.out.println("2 on malformed arguments or shorthand.");
    }
}
