package luxgrowth;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import luxgrowth.ml.ForecastSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class ForecastApiTest {

    private final ForecastApi api = new ForecastApi(settings());

    private static ForecastSettings settings() {
        Properties props = new Properties();
        props.setProperty("search.grid", "1,1,0; 0,1,1");
        props.setProperty("search.threads", "2");
        return ForecastSettings.of(props);
    }

    private static JsonObject json(ForecastApi.Response response) {
        return JsonParser.parseString(response.getBody()).getAsJsonObject();
    }

    /** Parses without Gson's lenient extensions such as bare NaN. */
    private static JsonObject strictJson(ForecastApi.Response response) throws IOException {
        JsonReader reader = new JsonReader(new StringReader(response.getBody()));
        JsonElement element = new Gson().getAdapter(JsonElement.class).read(reader);
        assertEquals(JsonToken.END_DOCUMENT, reader.peek());
        return element.getAsJsonObject();
    }

    private static Map<String, Object> sampleRequest() {
        Map<String, double[]> regressors = new LinkedHashMap<>();
        regressors.put("GDP", SampleData.GDP);
        regressors.put("Gini", SampleData.GINI);
        Map<String, Object> req = new LinkedHashMap<>();
        req.put("years", SampleData.YEARS);
        req.put("growth", SampleData.GROWTH);
        req.put("regressors", regressors);
        req.put("setName", "GDP+Gini");
        return req;
    }

    @Nested
    @DisplayName("POST /api/search")
    class Search {

        @Test
        @DisplayName("returns a table row or failure for every order")
        void table() {
            ForecastApi.Response response = api.search(ForecastApi.GSON.toJson(sampleRequest()));
            assertEquals(200, response.getStatus(), response.getBody());

            JsonObject body = json(response);
            assertEquals("GDP+Gini", body.get("regressorSet").getAsString());
            assertEquals(2, body.getAsJsonArray("table").size() + body.getAsJsonArray("failures").size());
            assertTrue(body.has("best"));
        }

        @Test
        @DisplayName("grid in the request replaces the configured one")
        void requestGrid() {
            Map<String, Object> req = sampleRequest();
            req.put("grid", Arrays.asList("0,1,0"));
            JsonObject body = json(api.search(ForecastApi.GSON.toJson(req)));
            assertEquals(1, body.getAsJsonArray("table").size());
            assertEquals("(0,1,0)", body.getAsJsonArray("table").get(0).getAsJsonObject().get("order").getAsString());
        }

        @Test
        @DisplayName("inconclusive p-values are written as null")
        void inconclusiveAsNull() throws IOException {
            Map<String, Object> req = new LinkedHashMap<>();
            req.put("years", new int[] {2000, 2001, 2002, 2003, 2004, 2005, 2006, 2007, 2008, 2009});
            req.put("growth", new double[] {2, 9, 8, 9, 10, 4, -8, 13, 13, 10});
            req.put("grid", Arrays.asList("0,1,0"));

            ForecastApi.Response response = api.search(ForecastApi.GSON.toJson(req));
            assertEquals(200, response.getStatus(), response.getBody());
            JsonObject row = strictJson(response).getAsJsonArray("table").get(0).getAsJsonObject();
            assertTrue(row.get("breuschPaganP").isJsonNull());
            assertFalse(row.get("ljungBoxP").isJsonNull());
            assertFalse(row.get("valid").getAsBoolean());
        }

        @Test
        @DisplayName("a covariate one value short is a client error")
        void misaligned() {
            Map<String, Object> req = sampleRequest();
            Map<String, double[]> regressors = new LinkedHashMap<>();
            regressors.put("GDP", Arrays.copyOf(SampleData.GDP, 19));
            req.put("regressors", regressors);

            ForecastApi.Response response = api.search(ForecastApi.GSON.toJson(req));
            assertEquals(400, response.getStatus());
            assertTrue(json(response).get("error").getAsString().startsWith("REGRESSOR_MISALIGNMENT"));
        }

        @Test
        @DisplayName("malformed JSON and missing fields are client errors")
        void badInput() {
            assertEquals(400, api.search("{not json").getStatus());
            assertEquals(400, api.search("").getStatus());
            assertEquals(400, api.search("{\"years\":[2000,2001]}").getStatus());
        }
    }

    @Nested
    @DisplayName("POST /api/forecast")
    class Forecast {

        @Test
        @DisplayName("random walk back-test against the observed year")
        void backTest() {
            Map<String, Object> req = new LinkedHashMap<>();
            req.put("years", new int[] {2000, 2001, 2002, 2003, 2004});
            req.put("growth", new double[] {1, 3, 2, 5, 7});
            req.put("order", "0,1,0");
            req.put("forecastYear", 2004);

            ForecastApi.Response response = api.forecast(ForecastApi.GSON.toJson(req));
            assertEquals(200, response.getStatus(), response.getBody());
            JsonObject body = json(response);
            assertEquals(2004, body.get("year").getAsInt());
            assertEquals(5.0, body.get("forecast").getAsDouble(), 1e-12);
            assertEquals(7.0, body.get("actual").getAsDouble(), 0.0);
            assertEquals(2.0, body.get("absoluteError").getAsDouble(), 1e-12);
            assertTrue(body.get("lower").getAsDouble() < 5.0);
        }

        @Test
        @DisplayName("next year with supplied regressor values")
        void nextYear() {
            Map<String, Object> req = sampleRequest();
            Map<String, Double> future = new LinkedHashMap<>();
            future.put("GDP", 3.1);
            future.put("Gini", 38.4);
            req.put("future", future);
            req.put("order", "1,1,0");
            req.put("forecastYear", 2023);

            ForecastApi.Response response = api.forecast(ForecastApi.GSON.toJson(req));
            assertEquals(200, response.getStatus(), response.getBody());
            JsonObject body = json(response);
            assertEquals(2023, body.get("year").getAsInt());
            assertFalse(body.has("actual"));
            assertEquals(2, body.getAsJsonObject("coefficients").size());
        }

        @Test
        @DisplayName("zero actual leaves the percentage error null")
        void zeroActual() throws IOException {
            Map<String, Object> req = new LinkedHashMap<>();
            req.put("years", new int[] {2000, 2001, 2002, 2003, 2004});
            req.put("growth", new double[] {1, 3, 2, 5, 0});
            req.put("order", "0,1,0");
            req.put("forecastYear", 2004);

            ForecastApi.Response response = api.forecast(ForecastApi.GSON.toJson(req));
            assertEquals(200, response.getStatus(), response.getBody());
            JsonObject body = strictJson(response);
            assertEquals(5.0, body.get("absoluteError").getAsDouble(), 1e-12);
            assertTrue(body.get("percentageError").isJsonNull());
        }

        @Test
        @DisplayName("a missing future value is a client error")
        void nullFutureValue() {
            ForecastApi.Response response = api.forecast("{\"years\":[2000,2001,2002,2003,2004],"
                + "\"growth\":[1,3,2,5,7],\"regressors\":{\"GDP\":[1,2,3,2,4]},"
                + "\"order\":\"0,1,0\",\"forecastYear\":2005,\"future\":{\"GDP\":null}}");
            assertEquals(400, response.getStatus());
            assertTrue(json(response).get("error").getAsString().contains("GDP"));
        }

        @Test
        @DisplayName("future values under other names are rejected")
        void shapeMismatch() {
            Map<String, Object> req = sampleRequest();
            Map<String, Double> future = new LinkedHashMap<>();
            future.put("Inflation", 6.8);
            req.put("future", future);
            req.put("order", "1,1,0");
            req.put("forecastYear", 2023);

            ForecastApi.Response response = api.forecast(ForecastApi.GSON.toJson(req));
            assertEquals(400, response.getStatus());
            assertTrue(json(response).get("error").getAsString().startsWith("REGRESSOR_SHAPE_MISMATCH"));
        }

        @Test
        @DisplayName("order and year are required")
        void missingFields() {
            Map<String, Object> req = sampleRequest();
            assertEquals(400, api.forecast(ForecastApi.GSON.toJson(req)).getStatus());
            req.put("order", "1,1");
            req.put("forecastYear", 2022);
            assertEquals(400, api.forecast(ForecastApi.GSON.toJson(req)).getStatus());
        }
    }

    @Test
    @DisplayName("sample and health payloads")
    void sampleAndHealth() {
        JsonObject sample = json(api.sample());
        assertEquals(20, sample.getAsJsonArray("years").size());
        assertEquals(3, sample.getAsJsonObject("regressors").size());
        assertEquals("ok", json(api.health(7000)).get("status").getAsString());
    }
}
