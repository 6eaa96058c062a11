package com.ttennebkram.imagelab.engine;

import com.google.gson.JsonArray;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.ttennebkram.imagelab.ValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RequestParametersTest {

    @Test
    void missingAndNullFallBackToDefaults() {
        JsonObject json = new JsonObject();
        json.add("sigma", JsonNull.INSTANCE);
        RequestParameters params = new RequestParameters(json);

        assertEquals(2.5, params.getDouble("sigma", 2.5));
        assertEquals(7, params.getInt("kernel_size", 7));
        assertEquals("low", params.getString("filter_type", "low"));
    }

    @Test
    void numbersAcceptedAsStrings() {
        JsonObject json = new JsonObject();
        json.addProperty("cutoff", "40");
        json.addProperty("ratio", "0.25");
        RequestParameters params = new RequestParameters(json);

        assertEquals(40, params.getInt("cutoff", 30));
        assertEquals(0.25, params.getDouble("ratio", 0.05));
    }

    @Test
    void malformedValuesRejected() {
        JsonObject json = new JsonObject();
        json.addProperty("kernel_size", 3.5);
        json.addProperty("sigma", "wide");
        json.add("cutoff", new JsonArray());
        json.addProperty("mean", "NaN");
        RequestParameters params = new RequestParameters(json);

        assertThrows(ValidationException.class, () -> params.getInt("kernel_size", 3));
        assertThrows(ValidationException.class, () -> params.getDouble("sigma", 1));
        assertThrows(ValidationException.class, () -> params.getInt("cutoff", 30));
        assertThrows(ValidationException.class, () -> params.getDouble("mean", 0));
        assertThrows(ValidationException.class, () -> params.requireString("noise_type"));
    }
}
