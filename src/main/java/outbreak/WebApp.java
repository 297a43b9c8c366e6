package outbreak;

import io.javalin.Javalin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import outbreak.io.Json;

import java.util.HashMap;
import java.util.Map;

/**
 * JSON API over the pipeline.
 * Run with: mvn exec:java -Dexec.mainClass="outbreak.WebApp"
 * <p>
 * {@code GET /api/health}, {@code POST /api/analyze} (see {@link AnalyzeHandler}).
 */
public class WebApp {

    private static final Logger log = LoggerFactory.getLogger(WebApp.class);

    static int getPort() {
        String env = System.getenv("PORT");
        if (env != null && !env.isBlank()) {
            try {
                return Integer.parseInt(env.trim());
            } catch (NumberFormatException e) {
                log.warn("Ignoring invalid PORT '{}'", env);
            }
        }
        return 7000;
    }

    public static Javalin create() {
        Javalin app = Javalin.create();
        app.post("/api/analyze", new AnalyzeHandler());
        app.get("/api/health", ctx -> {
            Map<String, Object> h = new HashMap<>();
            h.put("status", "ok");
            ctx.contentType("application/json").result(Json.GSON.toJson(h));
        });
        app.exception(OutbreakException.class, (e, ctx) -> {
            Map<String, Object> err = new HashMap<>();
            err.put("error", e.getMessage());
            err.put("kind", e.getKind());
            ctx.status(422).contentType("application/json").result(Json.GSON.toJson(err));
        });
        return app;
    }

    public static void main(String[] args) {
        int port = getPort();
        create().start("0.0.0.0", port);
        log.info("Outbreak API listening on http://localhost:{}", port);
    }
}
