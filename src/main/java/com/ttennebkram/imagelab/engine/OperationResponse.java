package com.ttennebkram.imagelab.engine;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.ttennebkram.imagelab.io.ImageCodec;
import com.ttennebkram.imagelab.model.EdgeResult;
import com.ttennebkram.imagelab.model.Histogram;
import com.ttennebkram.imagelab.model.HistogramResult;
import com.ttennebkram.imagelab.model.Image;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one operation: a status message plus whatever images and numeric
 * artifacts the operation produced.
 */
public final class OperationResponse {

    // Image names
    public static final String RESULT = "result";
    public static final String MAGNITUDE = "magnitude";
    public static final String GRAD_X = "grad_x";
    public static final String GRAD_Y = "grad_y";
    public static final String EDGES = "edges";
    public static final String SPECTRUM = "spectrum";
    public static final String MASK = "mask";
    public static final String FILTERED_SPECTRUM = "filtered_spectrum";
    public static final String HYBRID = "hybrid";
    public static final String LOW_FREQ = "low_freq";
    public static final String HIGH_FREQ = "high_freq";

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private final String message;
    private final String sessionId;
    private final Map<String, Image> images;
    private final HistogramResult histogram;
    private final EdgeResult.Layout layout;
    private final float[] unitSamples;
    private final Integer effectiveCutoff;

    private OperationResponse(Builder builder) {
        this.message = builder.message;
        this.sessionId = builder.sessionId;
        this.images = Collections.unmodifiableMap(new LinkedHashMap<>(builder.images));
        this.histogram = builder.histogram;
        this.layout = builder.layout;
        this.unitSamples = builder.unitSamples;
        this.effectiveCutoff = builder.effectiveCutoff;
    }

    static Builder builder(String message) {
        return new Builder(message);
    }

    public String getMessage() {
        return message;
    }

    /** Session the operation ran against; null for hybrid. */
    public String getSessionId() {
        return sessionId;
    }

    public Map<String, Image> getImages() {
        return images;
    }

    public Image getImage(String name) {
        return images.get(name);
    }

    /** Shorthand for the {@value #RESULT} image. */
    public Image getResult() {
        return images.get(RESULT);
    }

    public boolean hasImage(String name) {
        return images.containsKey(name);
    }

    public HistogramResult getHistogram() {
        return histogram;
    }

    /** Edge responses only. */
    public EdgeResult.Layout getLayout() {
        return layout;
    }

    /** Samples in [0, 1] for a 0-1 normalization, otherwise null. */
    public float[] getUnitSamples() {
        return unitSamples == null ? null : unitSamples.clone();
    }

    /** Frequency responses only: the radius actually used after clamping. */
    public Integer getEffectiveCutoff() {
        return effectiveCutoff;
    }

    // ===== JSON =====

    /**
     * Numeric artifacts and image shapes, without pixel data.
     */
    public JsonObject toJson() {
        return toJson(null);
    }

    /**
     * As {@link #toJson()}, with each image also embedded as a base64 PNG when a codec is given.
     */
    public JsonObject toJson(ImageCodec codec) {
        JsonObject root = new JsonObject();
        root.addProperty("message", message);
        if (sessionId != null) {
            root.addProperty("session_id", sessionId);
        }
        if (layout != null) {
            root.addProperty("type", layout.wireName());
        }
        if (effectiveCutoff != null) {
            root.addProperty("cutoff", effectiveCutoff);
        }

        if (!images.isEmpty()) {
            JsonObject imagesJson = new JsonObject();
            for (Map.Entry<String, Image> entry : images.entrySet()) {
                Image image = entry.getValue();
                JsonObject imageJson = new JsonObject();
                imageJson.addProperty("rows", image.rows());
                imageJson.addProperty("cols", image.cols());
                imageJson.addProperty("channels", image.channels());
                if (codec != null) {
                    imageJson.addProperty("png", codec.encodeBase64(image));
                }
                imagesJson.add(entry.getKey(), imageJson);
            }
            root.add("images", imagesJson);
        }

        if (histogram != null) {
            JsonObject histogramJson = new JsonObject();
            for (Histogram h : histogram.histograms()) {
                histogramJson.add(h.channel(), GSON.toJsonTree(h.counts()));
            }
            root.add("histogram", histogramJson);
            if (histogram.hasCdf()) {
                root.add("cdf", GSON.toJsonTree(histogram.cdf().values()));
            }
        }

        if (unitSamples != null) {
            JsonArray samples = new JsonArray(unitSamples.length);
            for (float sample : unitSamples) {
                samples.add(sample);
            }
            root.add("unit_samples", samples);
        }
        return root;
    }

    public String toJsonString() {
        return GSON.toJson(toJson());
    }

    @Override
    public String toString() {
        return "OperationResponse{" + message + ", images=" + images.keySet() + "}";
    }

    static final class Builder {
        private final String message;
        private String sessionId;
        private final Map<String, Image> images = new LinkedHashMap<>();
        private HistogramResult histogram;
        private EdgeResult.Layout layout;
        private float[] unitSamples;
        private Integer effectiveCutoff;

        private Builder(String message) {
            this.message = message;
        }

        Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        Builder image(String name, Image image) {
            images.put(name, image);
            return this;
        }

        Builder histogram(HistogramResult histogram) {
            this.histogram = histogram;
            return this;
        }

        Builder layout(EdgeResult.Layout layout) {
            this.layout = layout;
            return this;
        }

        Builder unitSamples(float[] unitSamples) {
            this.unitSamples = unitSamples;
            return this;
        }

        Builder effectiveCutoff(int effectiveCutoff) {
            this.effectiveCutoff = effectiveCutoff;
            return this;
        }

        OperationResponse build() {
            return new OperationResponse(this);
        }
    }
}
