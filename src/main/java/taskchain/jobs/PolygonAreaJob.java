package taskchain.jobs;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import taskchain.engine.job.Job;
import taskchain.engine.job.JobOutput;
import taskchain.engine.model.TaskView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;

/**
 * Computes the geodesic area, in square meters, of a GeoJSON Polygon or
 * MultiPolygon given as the task payload.
 * <p>
 * Rings are measured on a sphere of radius {@value #EARTH_RADIUS_M} m; the
 * first ring of a polygon is its outline and every further ring is a hole.
 */
public class PolygonAreaJob implements Job {

    public static final String TASK_TYPE = "polygon-area";

    private static final Logger log = LoggerFactory.getLogger(PolygonAreaJob.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final double EARTH_RADIUS_M = 6378137;

    @Override
    public JobOutput run(TaskView task) throws Exception {
        log.info("Running polygon area calculation for task {}...", task.taskId());
        try {
            double area = area(task.payload());
            String result = BigDecimal.valueOf(area).toPlainString();
            log.info("The polygon area is {} square meters", result);
            return JobOutput.success(result);
        } catch (Exception e) {
            throw new IllegalArgumentException(
                    "Error running polygon area calculation for task " + task.taskId() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Area of a GeoJSON geometry document.
     *
     * @throws IllegalArgumentException if the document is not a Polygon or MultiPolygon
     */
    static double area(String geoJson) throws Exception {
        if (geoJson == null || geoJson.isBlank()) {
            throw new IllegalArgumentException("No GeoJSON payload");
        }

        JsonNode geometry = MAPPER.readTree(geoJson);
        String type = geometry.path("type").asText();
        JsonNode coordinates = geometry.path("coordinates");

        switch (type) {
            case "Polygon":
                return polygonArea(requireArray(coordinates, type));
            case "MultiPolygon":
                double total = 0;
                for (JsonNode polygon : requireArray(coordinates, type)) {
                    total += polygonArea(requireArray(polygon, type));
                }
                return total;
            default:
                throw new IllegalArgumentException(
                        "Invalid geometry type: " + type + ". Expected Polygon or MultiPolygon.");
        }
    }

    private static JsonNode requireArray(JsonNode coordinates, String type) {
        if (!coordinates.isArray()) {
            throw new IllegalArgumentException("Invalid coordinates for " + type + ": expected an array");
        }
        return coordinates;
    }

    private static double polygonArea(JsonNode rings) {
        if (rings.isEmpty()) {
            return 0;
        }
        double total = Math.abs(ringArea(rings.get(0)));
        for (int i = 1; i < rings.size(); i++) {
            total -= Math.abs(ringArea(rings.get(i)));
        }
        return total;
    }

    /**
     * Signed area of a closed ring of [lon, lat] positions.
     * The last position repeats the first and is not counted.
     */
    private static double ringArea(JsonNode ring) {
        int length = ring.size() - 1;
        if (length <= 2) {
            return 0;
        }

        double total = 0;
        for (int i = 0; i < length; i++) {
            JsonNode lower = ring.get(i);
            JsonNode middle = ring.get(i + 1 == length ? 0 : i + 1);
            JsonNode upper = ring.get(i + 2 >= length ? (i + 2) % length : i + 2);

            double lowerX = Math.toRadians(lower.get(0).asDouble());
            double middleY = Math.toRadians(middle.get(1).asDouble());
            double upperX = Math.toRadians(upper.get(0).asDouble());

            total += (upperX - lowerX) * Math.sin(middleY);
        }
        return total * EARTH_RADIUS_M * EARTH_RADIUS_M / 2;
    }
}
