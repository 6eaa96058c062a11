package com.ttennebkram.imagelab.engine;

import com.google.gson.JsonObject;
import com.ttennebkram.imagelab.DecodeException;
import com.ttennebkram.imagelab.TestImages;
import com.ttennebkram.imagelab.ValidationException;
import com.ttennebkram.imagelab.io.ImageCodec;
import com.ttennebkram.imagelab.model.Image;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OperationRequestTest {

    private final ImageCodec codec = new ImageCodec();

    @Test
    void parsesFlatSessionRequest() {
        OperationRequest request = OperationRequest.fromJson(
                "{\"operation\": \"apply_filter\", \"session_id\": \"abc\", \"filter_type\": \"gaussian\","
                        + " \"kernel_size\": 5, \"sigma\": \"1.5\"}", codec);

        assertEquals(OperationKind.FILTER, request.getKind());
        assertEquals("abc", request.getSessionId());
        assertEquals(5, request.getParameters().getInt("kernel_size", 3));
        assertEquals(1.5, request.getParameters().getDouble("sigma", 1.0));
        assertFalse(request.getParameters().has("operation"));
    }

    @Test
    void parsesHybridRequestWithEmbeddedImages() {
        Image image = TestImages.randomRgb(6, 6, 1L);
        JsonObject json = new JsonObject();
        json.addProperty("operation", "hybrid");
        json.addProperty("file1", codec.encodeBase64(image));
        json.addProperty("file2", codec.encodeBase64(image));
        json.addProperty("cutoff_low", 12);

        OperationRequest request = OperationRequest.fromJson(json, codec);
        assertEquals(OperationKind.HYBRID, request.getKind());
        assertNull(request.getSessionId());
        assertEquals(image, request.getImage1());
        assertEquals(12, request.getParameters().getInt("cutoff_low", 30));
    }

    @Test
    void rejectsMalformedRequests() {
        assertThrows(ValidationException.class, () -> OperationRequest.fromJson("not json {", codec));
        assertThrows(ValidationException.class, () -> OperationRequest.fromJson("[1, 2]", codec));
        assertThrows(ValidationException.class, () -> OperationRequest.fromJson("{\"session_id\": \"x\"}", codec));
        assertThrows(ValidationException.class, () -> OperationRequest.fromJson("{\"operation\": \"rotate\", \"session_id\": \"x\"}", codec));
        assertThrows(ValidationException.class, () -> OperationRequest.fromJson("{\"operation\": \"undo\"}", codec));
        assertThrows(DecodeException.class,
                () -> OperationRequest.fromJson("{\"operation\": \"hybrid\", \"file1\": \"AAAA\", \"file2\": \"AAAA\"}", codec));
    }

    @Test
    void operationNamesAreCaseInsensitive() {
        assertEquals(OperationKind.NOISE, OperationKind.fromWireName("ADD_NOISE"));
    }
}
