package outbreak;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import outbreak.data.CaseRecord;
import outbreak.io.CaseCsvReader;
import outbreak.io.ReportCsvWriter;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Batch run over a line-list CSV: clusters the states, forecasts every (state, disease)
 * pair and prints alerts and recommended actions.
 * <p>
 * Usage: {@code Main <cases.csv> [config.json] [outputDir]}
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        if (args.length < 1 || args[0].isBlank()) {
            System.err.println("Usage: Main <cases.csv> [config.json] [outputDir]");
            System.exit(2);
        }
        try {
            OutbreakConfig config = args.length > 1 && !args[1].isBlank()
                ? OutbreakConfig.load(Paths.get(args[1].trim()))
                : OutbreakConfig.defaults();
            List<CaseRecord> records = new CaseCsvReader("state", "report_date", config.getDiseases())
                .read(Paths.get(args[0].trim()));

            OutbreakReport report = new OutbreakPipeline(config).run(records, List.of());
            print(report);

            if (args.length > 2 && !args[2].isBlank()) {
                Path out = Paths.get(args[2].trim());
                new ReportCsvWriter().write(report, out);
                System.out.println("Results written to " + out.toAbsolutePath());
            }
        } catch (Exception e) {
            log.error("Run failed", e);
            String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            System.err.println("Error: " + msg);
            System.exit(1);
        }
    }

    static void print(OutbreakReport report) {
        System.out.println("=== Clusters ===");
        if (report.getClusters() == null) {
            System.out.println("Clustering skipped: " + report.getClusteringFailure());
        } else {
            for (int id = 0; id < report.getClusters().k(); id++) {
                System.out.println("Cluster " + id + ": " + report.getClusters().members(id));
            }
        }
        System.out.println();

        System.out.println("=== Forecast alerts ===");
        for (PairOutcome o : report.getOutcomes()) {
            System.out.printf("%s  %s  threshold %s%n", o.getKey(), o.getForecast().getModel(), o.getThreshold());
            for (int i = 0; i < o.getAlerts().size(); i++) {
                System.out.printf("  %s%s  %s%n", o.getForecast().getPoints().get(i),
                    o.getAlerts().get(i).isTriggered() ? "  ALERT" : "",
                    o.getRecommendations().get(i).getActionText());
            }
        }
        System.out.println();

        System.out.println("=== Skipped pairs ===");
        for (PairFailure f : report.getFailures()) {
            System.out.println(f);
        }
    }
}
