package outbreak;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import outbreak.data.CaseRecord;
import outbreak.data.SeriesKey;
import outbreak.io.Json;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code POST /api/analyze}: runs the pipeline over records posted as JSON.
 * <pre>
 * {"records": [{"entity": "Lagos", "date": "2024-01-03", "disease": "cholera", "count": 4}, ...],
 *  "pairs":   [{"entity": "Lagos", "disease": "cholera"}],
 *  "config":  {"clusterCount": 2}}
 * </pre>
 * Omitted pairs mean every pair; omitted config fields keep their defaults.
 */
public class AnalyzeHandler implements Handler {

    @Override
    public void handle(Context ctx) {
        Response response = analyze(ctx.body());
        ctx.status(response.status).contentType("application/json").result(Json.GSON.toJson(response.body));
    }

    public Response analyze(String body) {
        Map<String, Object> out = new HashMap<>();
        if (body == null || body.isBlank()) {
            out.put("error", "Missing request body");
            return new Response(400, out);
        }
        Request req;
        try {
            req = Json.GSON.fromJson(body, Request.class);
        } catch (JsonParseException e) {
            out.put("error", "Invalid JSON: " + e.getMessage());
            return new Response(400, out);
        }
        if (req == null || req.records == null || req.records.isEmpty()) {
            out.put("error", "Missing or empty 'records' array");
            return new Response(400, out);
        }

        List<CaseRecord> records = new ArrayList<>(req.records.size());
        List<SeriesKey> pairs = new ArrayList<>();
        OutbreakConfig config;
        try {
            for (RecordJson r : req.records) {
                if (r == null) throw new IllegalArgumentException("null record");
                records.add(new CaseRecord(r.entity, r.date, r.disease, r.count));
            }
            if (req.pairs != null) {
                for (PairJson p : req.pairs) {
                    if (p == null) throw new IllegalArgumentException("null pair");
                    pairs.add(new SeriesKey(p.entity, p.disease));
                }
            }
            config = req.config == null
                ? OutbreakConfig.defaults()
                : OutbreakConfig.fromJson(req.config.toString());
        } catch (IllegalArgumentException | ConfigurationException e) {
            out.put("error", e.getMessage());
            return new Response(400, out);
        }

        OutbreakReport report = new OutbreakPipeline(config).run(records, pairs);
        out.put("clusters", report.clusterRows());
        out.put("alerts", report.alertRows());
        out.put("failures", report.getFailures());
        if (report.getClusteringFailure() != null) {
            out.put("clusteringFailure", report.getClusteringFailure());
        }
        return new Response(200, out);
    }

    public static final class Response {
        final int status;
        final Map<String, Object> body;

        Response(int status, Map<String, Object> body) {
            this.status = status;
            this.body = body;
        }

        public int getStatus() { return status; }
        public Map<String, Object> getBody() { return body; }
    }

    static final class Request {
        List<RecordJson> records;
        List<PairJson> pairs;
        JsonObject config;
    }

    static final class RecordJson {
        String entity;
        LocalDate date;
        String disease;
        long count;
    }

    static final class PairJson {
        String entity;
        String disease;
    }
}
