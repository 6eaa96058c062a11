package com.ttennebkram.imagelab.engine;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.ttennebkram.imagelab.ValidationException;
import com.ttennebkram.imagelab.io.ImageCodec;
import com.ttennebkram.imagelab.model.Image;

/**
 * One operation to run: what, on which session, with which parameters.
 *
 * The JSON form is flat, the way form posts arrive:
 * <pre>
 * {"operation": "apply_filter", "session_id": "...", "filter_type": "median", "kernel_size": 5}
 * {"operation": "hybrid", "file1": "&lt;base64 png&gt;", "file2": "&lt;base64 png&gt;", "cutoff_low": 30}
 * </pre>
 */
public final class OperationRequest {

    public static final String OPERATION = "operation";
    public static final String SESSION_ID = "session_id";
    public static final String FILE1 = "file1";
    public static final String FILE2 = "file2";

    private final OperationKind kind;
    private final String sessionId;
    private final RequestParameters parameters;
    private final Image image1;
    private final Image image2;

    private OperationRequest(OperationKind kind, String sessionId, RequestParameters parameters,
                             Image image1, Image image2) {
        this.kind = kind;
        this.sessionId = sessionId;
        this.parameters = parameters;
        this.image1 = image1;
        this.image2 = image2;
    }

    /**
     * A session operation. {@code parameters} may be null for undo and reset.
     */
    public static OperationRequest of(OperationKind kind, String sessionId, JsonObject parameters) {
        if (kind == null) {
            throw new ValidationException("operation is required");
        }
        if (kind == OperationKind.HYBRID) {
            throw new ValidationException("hybrid takes two images, not a session");
        }
        if (sessionId == null || sessionId.isEmpty()) {
            throw new ValidationException(SESSION_ID + " is required for " + kind.wireName());
        }
        return new OperationRequest(kind, sessionId, new RequestParameters(parameters), null, null);
    }

    public static OperationRequest hybrid(Image image1, Image image2, JsonObject parameters) {
        if (image1 == null || image2 == null) {
            throw new ValidationException("hybrid requires two images");
        }
        return new OperationRequest(OperationKind.HYBRID, null, new RequestParameters(parameters), image1, image2);
    }

    public static OperationRequest fromJson(String json, ImageCodec codec) {
        JsonElement element;
        try {
            element = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new ValidationException("Request is not valid JSON: " + e.getMessage(), e);
        }
        if (!element.isJsonObject()) {
            throw new ValidationException("Request must be a JSON object");
        }
        return fromJson(element.getAsJsonObject(), codec);
    }

    /**
     * Parse a flat request object. Hybrid images are base64-encoded and decoded with {@code codec}.
     */
    public static OperationRequest fromJson(JsonObject json, ImageCodec codec) {
        RequestParameters fields = new RequestParameters(json);
        OperationKind kind = OperationKind.fromWireName(fields.requireString(OPERATION));

        JsonObject parameters = json.deepCopy();
        parameters.remove(OPERATION);
        parameters.remove(SESSION_ID);
        parameters.remove(FILE1);
        parameters.remove(FILE2);

        if (!kind.needsSession()) {
            Image first = codec.decodeBase64(fields.requireString(FILE1));
            Image second = codec.decodeBase64(fields.requireString(FILE2));
            return hybrid(first, second, parameters);
        }
        return of(kind, fields.requireString(SESSION_ID), parameters);
    }

    public OperationKind getKind() {
        return kind;
    }

    /** Null for hybrid requests. */
    public String getSessionId() {
        return sessionId;
    }

    public RequestParameters getParameters() {
        return parameters;
    }

    public Image getImage1() {
        return image1;
    }

    public Image getImage2() {
        return image2;
    }

    @Override
    public String toString() {
        return kind.wireName() + (sessionId != null ? " [" + sessionId + "] " : " ") + parameters;
    }
}
