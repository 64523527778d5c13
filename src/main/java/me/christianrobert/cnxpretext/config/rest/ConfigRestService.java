package me.christianrobert.cnxpretext.config.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.cnxpretext.config.service.ConfigService;
import me.christianrobert.cnxpretext.transformer.context.ConversionOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST endpoint for the converter configuration.
 *
 * <p>Usage:
 * <pre>
 * # Show raw configuration
 * curl http://localhost:8080/api/config
 *
 * # Show the options a conversion started now would use
 * curl http://localhost:8080/api/config/effective
 *
 * # Change the pixel-to-percent ratio for image widths
 * curl -X PUT http://localhost:8080/api/config/converter.pixels-per-percent \
 *   -H "Content-Type: application/json" --data '{"value": 6}'
 * </pre>
 */
@Path("/api/config")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ConfigRestService {

    private static final Logger log = LoggerFactory.getLogger(ConfigRestService.class);

    @Inject
    ConfigService configService;

    @GET
    public Response getConfiguration() {
        log.info("Getting configuration");
        return Response.ok(configService.getAllConfiguration()).build();
    }

    /**
     * Converter options as they would be applied to the next conversion,
     * after defaults have been filled in for missing or invalid keys.
     */
    @GET
    @Path("/effective")
    public Response getEffectiveOptions() {
        ConversionOptions options = ConversionOptions.fromConfig(configService);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("mediaPrefixes", options.getMediaPrefixes());
        response.put("mediaTargetPrefix", options.getMediaTargetPrefix());
        response.put("pixelsPerPercent", options.getPixelsPerPercent());
        response.put("indentUnit", options.getIndentUnit());
        response.put("variableNames", options.getVariableNames());
        return Response.ok(response).build();
    }

    @POST
    public Response saveConfiguration(Map<String, Object> config) {
        log.info("Saving configuration with {} entries", config.size());

        for (Map.Entry<String, Object> entry : config.entrySet()) {
            String problem = validate(entry.getKey(), entry.getValue());
            if (problem != null) {
                log.warn("Rejected configuration: {}", problem);
                return badRequest(problem);
            }
        }

        configService.updateConfiguration(config);

        Map<String, String> response = new HashMap<>();
        response.put("status", "success");
        response.put("message", "Configuration saved successfully");
        return Response.ok(response).build();
    }

    @GET
    @Path("/{key}")
    public Response getConfigValue(@PathParam("key") String key) {
        log.debug("Getting config value for key: {}", key);

        Object value = configService.getConfigValue(key);
        if (value == null) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(Map.of("error", "Configuration key not found: " + key))
                    .build();
        }

        return Response.ok(Map.of("key", key, "value", value)).build();
    }

    @PUT
    @Path("/{key}")
    public Response setConfigValue(@PathParam("key") String key, Map<String, Object> body) {
        log.debug("Setting config value for key: {}", key);

        if (body == null || !body.containsKey("value")) {
            return badRequest("Request body must contain 'value' field");
        }

        Object value = body.get("value");
        String problem = validate(key, value);
        if (problem != null) {
            log.warn("Rejected config value for {}: {}", key, problem);
            return badRequest(problem);
        }

        configService.setConfigValue(key, value);

        Map<String, Object> response = new HashMap<>();
        response.put("status", "success");
        response.put("key", key);
        response.put("value", value);
        return Response.ok(response).build();
    }

    @POST
    @Path("/reset")
    public Response resetConfiguration() {
        log.info("Resetting configuration to defaults");
        configService.resetToDefaults();
        return Response.ok(Map.of("status", "success", "message", "Configuration reset to defaults")).build();
    }

    /**
     * Returns a description of what is wrong with the value, or null if it is acceptable.
     */
    static String validate(String key, Object value) {
        if (value == null) {
            return "Value for " + key + " must not be null";
        }
        if (ConfigService.PIXELS_PER_PERCENT.equals(key)) {
            try {
                int ratio = value instanceof Number
                        ? ((Number) value).intValue()
                        : Integer.parseInt(value.toString().trim());
                if (ratio <= 0) {
                    return ConfigService.PIXELS_PER_PERCENT + " must be a positive integer";
                }
            } catch (NumberFormatException e) {
                return ConfigService.PIXELS_PER_PERCENT + " must be a positive integer";
            }
        }
        return null;
    }

    private Response badRequest(String message) {
        return Response.status(Response.Status.BAD_REQUEST)
                .entity(Map.of("error", message))
                .build();
    }
}
