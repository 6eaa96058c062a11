package com.ttennebkram.imagelab.engine;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.ttennebkram.imagelab.ValidationException;

/**
 * Typed, defaulted access to the parameters of one request.
 *
 * Values may arrive as JSON numbers or as strings (form fields), so both are accepted.
 * A present but malformed value is a {@link ValidationException}, never a silent default.
 */
public final class RequestParameters {

    private final JsonObject json;

    public RequestParameters(JsonObject json) {
        this.json = json != null ? json : new JsonObject();
    }

    public static RequestParameters empty() {
        return new RequestParameters(new JsonObject());
    }

    public boolean has(String key) {
        return json.has(key) && !json.get(key).isJsonNull();
    }

    /**
     * Helper to safely get an int. Fractional values are rejected.
     */
    public int getInt(String key, int defaultValue) {
        if (!has(key)) {
            return defaultValue;
        }
        double value = getDouble(key, defaultValue);
        if (value != Math.rint(value) || value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            throw new ValidationException(key + " must be an integer, got " + json.get(key));
        }
        return (int) value;
    }

    /**
     * Helper to safely get a double. NaN and infinities are rejected.
     */
    public double getDouble(String key, double defaultValue) {
        if (!has(key)) {
            return defaultValue;
        }
        JsonPrimitive primitive = primitive(key);
        double value;
        try {
            value = primitive.getAsDouble();
        } catch (NumberFormatException e) {
            throw new ValidationException(key + " must be a number, got " + primitive, e);
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new ValidationException(key + " must be finite, got " + primitive);
        }
        return value;
    }

    /**
     * Helper to safely get a String.
     */
    public String getString(String key, String defaultValue) {
        if (!has(key)) {
            return defaultValue;
        }
        return primitive(key).getAsString();
    }

    /**
     * A required String: missing means the request is malformed.
     */
    public String requireString(String key) {
        if (!has(key)) {
            throw new ValidationException(key + " is required");
        }
        return primitive(key).getAsString();
    }

    private JsonPrimitive primitive(String key) {
        JsonElement element = json.get(key);
        if (!element.isJsonPrimitive()) {
            throw new ValidationException(key + " must be a scalar value, got " + element);
        }
        return element.getAsJsonPrimitive();
    }

    public JsonObject toJson() {
        return json.deepCopy();
    }

    @Override
    public String toString() {
        return json.toString();
    }
}
