package outbreak.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import outbreak.ConfigurationException;
import outbreak.data.CaseRecord;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the wide line-list layout: one row per report with an entity column, a date column
 * and one count column per disease. Each row yields one {@link CaseRecord} per disease column.
 * <p>
 * Rows whose date does not parse are dropped; a count that does not parse, or is negative,
 * is read as 0. Other columns (names, age, serotype, ...) are ignored.
 */
public class CaseCsvReader {

    private static final Logger log = LoggerFactory.getLogger(CaseCsvReader.class);

    /** Disease columns of the national line-list export. */
    public static final List<String> DEFAULT_DISEASES = List.of(
        "cholera", "diarrhoea", "measles", "viral_haemmorrhaphic_fever", "meningitis",
        "ebola", "marburg_virus", "yellow_fever", "rubella_mars", "malaria");

    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final String entityColumn;
    private final String dateColumn;
    private final List<String> diseases;

    public CaseCsvReader() {
        this("state", "report_date", List.of());
    }

    /** @param diseases disease columns to read; empty means the known disease columns present in the header */
    public CaseCsvReader(String entityColumn, String dateColumn, List<String> diseases) {
        this.entityColumn = entityColumn;
        this.dateColumn = dateColumn;
        this.diseases = List.copyOf(diseases);
    }

    public List<CaseRecord> read(Path path) throws IOException {
        return parse(Files.readAllLines(path, StandardCharsets.UTF_8));
    }

    public List<CaseRecord> parse(List<String> lines) {
        int headerLine = 0;
        while (headerLine < lines.size() && lines.get(headerLine).isBlank()) headerLine++;
        if (headerLine == lines.size()) throw new ConfigurationException("CSV has no header row");
        List<String> header = splitLine(lines.get(headerLine));
        for (int i = 0; i < header.size(); i++) header.set(i, header.get(i).trim().toLowerCase());

        int entityIdx = requireColumn(header, entityColumn);
        int dateIdx = requireColumn(header, dateColumn);
        List<String> columns = new ArrayList<>();
        List<Integer> indices = new ArrayList<>();
        for (String disease : diseases.isEmpty() ? DEFAULT_DISEASES : diseases) {
            int idx = header.indexOf(disease.toLowerCase());
            if (idx >= 0) {
                columns.add(disease);
                indices.add(idx);
            } else if (!diseases.isEmpty()) {
                throw new ConfigurationException("disease column '" + disease + "' not in CSV header");
            }
        }
        if (columns.isEmpty()) throw new ConfigurationException("CSV header has no disease columns: " + header);

        List<CaseRecord> out = new ArrayList<>();
        int dropped = 0;
        int repaired = 0;
        for (int i = headerLine + 1; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) continue;
            List<String> parts = splitLine(line);
            String entity = field(parts, entityIdx);
            LocalDate date = parseDate(field(parts, dateIdx));
            if (date == null || entity.isEmpty()) {
                dropped++;
                continue;
            }
            for (int c = 0; c < columns.size(); c++) {
                long count = parseCount(field(parts, indices.get(c)));
                if (count < 0) {
                    repaired++;
                    count = 0;
                }
                out.add(new CaseRecord(entity, date, columns.get(c), count));
            }
        }
        log.info("Read {} case records for {} diseases ({} rows dropped, {} counts repaired)",
            out.size(), columns.size(), dropped, repaired);
        return out;
    }

    private static int requireColumn(List<String> header, String name) {
        int idx = header.indexOf(name.toLowerCase());
        if (idx < 0) throw new ConfigurationException("CSV header lacks column '" + name + "'");
        return idx;
    }

    private static String field(List<String> parts, int idx) {
        return idx < parts.size() ? parts.get(idx).trim() : "";
    }

    static LocalDate parseDate(String text) {
        if (text == null || text.isEmpty()) return null;
        try {
            return LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(text, DATE_TIME).toLocalDate();
            } catch (DateTimeParseException e2) {
                return null;
            }
        }
    }

    /** -1 marks a value that had to be repaired. */
    static long parseCount(String text) {
        if (text == null || text.isEmpty()) return 0;
        try {
            double v = Double.parseDouble(text);
            if (Double.isNaN(v) || v < 0) return -1;
            return Math.round(v);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    /** Splits one CSV line, honouring double-quoted fields. */
    static List<String> splitLine(String line) {
        List<String> out = new ArrayList<>();
        StringBuilder sb = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (quoted) {
                if (ch == '"' && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    sb.append('"');
                    i++;
                } else if (ch == '"') {
                    quoted = false;
                } else {
                    sb.append(ch);
                }
            } else if (ch == '"') {
                quoted = true;
            } else if (ch == ',') {
                out.add(sb.toString());
                sb.setLength(0);
            } else {
                sb.append(ch);
            }
        }
        out.add(sb.toString());
        return out;
    }
}
