package luxgrowth;

import io.javalin.Javalin;
import io.javalin.http.Context;
import luxgrowth.ml.ForecastSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP front for the model search and forecast.
 * Run with: mvn exec:java -Dexec.mainClass="luxgrowth.WebApp"
 * <p>
 * GET /api/health, GET /api/sample, POST /api/search, POST /api/forecast. The port comes from
 * {@code web.port} (or the PORT environment variable), 7000 by default.
 */
public class WebApp {

    private static final Logger LOG = LoggerFactory.getLogger(WebApp.class);

    public static void main(String[] args) {
        ForecastSettings settings = ForecastSettings.load();
        start(settings);
    }

    public static Javalin start(ForecastSettings settings) {
        int port = settings.getPort();
        ForecastApi api = new ForecastApi(settings);
        Javalin app = Javalin.create().start("0.0.0.0", port);

        app.get("/api/health", ctx -> send(ctx, api.health(port)));
        app.get("/api/sample", ctx -> send(ctx, api.sample()));
        app.post("/api/search", ctx -> send(ctx, api.search(ctx.body())));
        app.post("/api/forecast", ctx -> send(ctx, api.forecast(ctx.body())));

        LOG.info("Luxury growth forecaster listening on http://localhost:{}", port);
        return app;
    }

    private static void send(Context ctx, ForecastApi.Response response) {
        ctx.status(response.getStatus()).contentType("application/json").result(response.getBody());
    }
}
