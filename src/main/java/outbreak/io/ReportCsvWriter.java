package outbreak.io;

import outbreak.AlertRow;
import outbreak.ClusterRow;
import outbreak.OutbreakReport;
import outbreak.PairFailure;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/** Writes a report as {@code alerts.csv}, {@code clusters.csv} and {@code failures.csv}. */
public class ReportCsvWriter {

    public void write(OutbreakReport report, Path directory) throws IOException {
        Files.createDirectories(directory);
        try (Writer w = Files.newBufferedWriter(directory.resolve("alerts.csv"), StandardCharsets.UTF_8)) {
            writeAlerts(report, w);
        }
        try (Writer w = Files.newBufferedWriter(directory.resolve("clusters.csv"), StandardCharsets.UTF_8)) {
            writeClusters(report, w);
        }
        try (Writer w = Files.newBufferedWriter(directory.resolve("failures.csv"), StandardCharsets.UTF_8)) {
            writeFailures(report, w);
        }
    }

    public void writeAlerts(OutbreakReport report, Writer out) throws IOException {
        out.write("entity,disease,period_start,predicted_cases,lower_bound,upper_bound,threshold,triggered,action_text\n");
        for (AlertRow r : report.alertRows()) {
            out.write(join(r.getEntity(), r.getDisease(), r.getPeriodStart().toString(),
                number(r.getPredictedCases()), number(r.getLowerBound()), number(r.getUpperBound()),
                number(r.getThreshold()), Boolean.toString(r.isTriggered()), r.getActionText()));
        }
    }

    public void writeClusters(OutbreakReport report, Writer out) throws IOException {
        out.write("entity,cluster_id\n");
        for (ClusterRow r : report.clusterRows()) {
            out.write(join(r.getEntity(), Integer.toString(r.getClusterId())));
        }
    }

    public void writeFailures(OutbreakReport report, Writer out) throws IOException {
        out.write("entity,disease,kind,message\n");
        for (PairFailure f : report.getFailures()) {
            out.write(join(f.getEntity(), f.getDisease(), f.getKind().name(), f.getMessage()));
        }
    }

    private static String number(Double v) {
        return v == null ? "" : String.format(Locale.ROOT, "%.4f", v);
    }

    private static String join(String... fields) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < fields.length; i++) {
            if (i > 0) sb.append(',');
            sb.append(quote(fields[i]));
        }
        return sb.append('\n').toString();
    }

    static String quote(String field) {
        if (field == null) return "";
        if (field.indexOf(',') < 0 && field.indexOf('"') < 0 && field.indexOf('\n') < 0) return field;
        return '"' + field.replace("\"", "\"\"") + '"';
    }
}
