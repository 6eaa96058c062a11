package com.ttennebkram.imagelab.engine;

import com.ttennebkram.imagelab.ValidationException;
import com.ttennebkram.imagelab.config.EngineConfig;
import com.ttennebkram.imagelab.model.EdgeResult;
import com.ttennebkram.imagelab.model.FrequencyResult;
import com.ttennebkram.imagelab.model.HistogramResult;
import com.ttennebkram.imagelab.model.HybridResult;
import com.ttennebkram.imagelab.model.Image;
import com.ttennebkram.imagelab.model.NormalizationResult;
import com.ttennebkram.imagelab.processing.EdgeDetector;
import com.ttennebkram.imagelab.processing.EdgeOperator;
import com.ttennebkram.imagelab.processing.EnhancementEngine;
import com.ttennebkram.imagelab.processing.EnhancementType;
import com.ttennebkram.imagelab.processing.FrequencyFilterEngine;
import com.ttennebkram.imagelab.processing.FrequencyFilterType;
import com.ttennebkram.imagelab.processing.HistogramAnalyzer;
import com.ttennebkram.imagelab.processing.HistogramType;
import com.ttennebkram.imagelab.processing.HybridComposer;
import com.ttennebkram.imagelab.processing.ImageProcessor;
import com.ttennebkram.imagelab.processing.NoiseSynthesizer;
import com.ttennebkram.imagelab.processing.NoiseType;
import com.ttennebkram.imagelab.processing.NormalizationRange;
import com.ttennebkram.imagelab.processing.SpatialFilterEngine;
import com.ttennebkram.imagelab.processing.SpatialFilterType;
import com.ttennebkram.imagelab.session.SessionStore;
import com.ttennebkram.imagelab.util.Mats;

import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

/**
 * Entry point for the whole catalogue of operations.
 *
 * Every request is parsed and validated before its session is touched, so a bad
 * parameter never leaves a session half-changed. Analysis operations (edges, histogram)
 * read the working image and return artifacts; hybrid never involves a session.
 */
public class ImageEngine {

    private static final Logger LOG = Logger.getLogger(ImageEngine.class.getName());

    // Request defaults
    public static final double DEFAULT_MEAN = 0;
    public static final double DEFAULT_SIGMA = 25;
    public static final double DEFAULT_LOW = -25;
    public static final double DEFAULT_HIGH = 25;
    public static final double DEFAULT_RATIO = 0.05;
    public static final int DEFAULT_KERNEL_SIZE = 3;
    public static final double DEFAULT_FILTER_SIGMA = 1.0;

    private final SessionStore sessions;
    private final NoiseSynthesizer noise;
    private final SpatialFilterEngine spatialFilters;
    private final EdgeDetector edges;
    private final HistogramAnalyzer histograms;
    private final EnhancementEngine enhancement;
    private final FrequencyFilterEngine frequency;
    private final HybridComposer hybrid;

    public ImageEngine(EngineConfig config, SessionStore sessions) {
        this.sessions = sessions;
        this.noise = new NoiseSynthesizer(config.newRandom());
        this.spatialFilters = new SpatialFilterEngine();
        this.edges = new EdgeDetector();
        this.histograms = new HistogramAnalyzer();
        this.enhancement = new EnhancementEngine(histograms, config.getEqualizationMode());
        this.frequency = new FrequencyFilterEngine();
        this.hybrid = new HybridComposer(frequency);
        LOG.info("Image engine ready: " + config);
    }

    public ImageEngine(EngineConfig config) {
        this(config, new SessionStore(config.getHistoryLimit()));
    }

    public ImageEngine() {
        this(EngineConfig.load());
    }

    public SessionStore getSessions() {
        return sessions;
    }

    // ===== Session lifecycle =====

    public OperationResponse upload(Image image) {
        String id = sessions.create(image);
        return OperationResponse.builder("Image uploaded successfully")
                .sessionId(id)
                .image(OperationResponse.RESULT, image)
                .build();
    }

    public OperationResponse undo(String sessionId) {
        Image working = sessions.undo(sessionId);
        return sessionResponse(sessionId, "Undo successful", working).build();
    }

    public OperationResponse reset(String sessionId) {
        Image working = sessions.reset(sessionId);
        return sessionResponse(sessionId, "Reset to original", working).build();
    }

    // ===== Dispatch =====

    public OperationResponse execute(OperationRequest request) {
        RequestParameters params = request.getParameters();
        String id = request.getSessionId();
        LOG.fine("Executing " + request);
        return switch (request.getKind()) {
            case NOISE -> addNoise(id, NoiseType.fromWireName(params.requireString("noise_type")), params);
            case FILTER -> applyFilter(id,
                    SpatialFilterType.fromWireName(params.requireString("filter_type")),
                    params.getInt("kernel_size", DEFAULT_KERNEL_SIZE),
                    params.getDouble("sigma", DEFAULT_FILTER_SIGMA));
            case EDGE -> detectEdges(id,
                    EdgeOperator.fromWireName(params.requireString("edge_type")),
                    params.getDouble("threshold1", EdgeDetector.DEFAULT_THRESHOLD1),
                    params.getDouble("threshold2", EdgeDetector.DEFAULT_THRESHOLD2));
            case HISTOGRAM -> histogram(id,
                    HistogramType.fromWireName(params.getString("hist_type", HistogramType.GRAYSCALE.wireName())));
            case ENHANCEMENT -> enhanceFromParams(id, params);
            case FREQUENCY -> frequencyFilter(id,
                    FrequencyFilterType.fromWireName(params.getString("filter_type", FrequencyFilterType.LOW.wireName())),
                    params.getInt("cutoff", FrequencyFilterEngine.DEFAULT_CUTOFF));
            case HYBRID -> hybrid(request.getImage1(), request.getImage2(),
                    params.getInt("cutoff_low", HybridComposer.DEFAULT_CUTOFF_LOW),
                    params.getInt("cutoff_high", HybridComposer.DEFAULT_CUTOFF_HIGH));
            case UNDO -> undo(id);
            case RESET -> reset(id);
        };
    }

    // ===== Mutating operations =====

    /**
     * Reads mean and sigma for gaussian, low and high for uniform, ratio and
     * salt_vs_pepper for salt_pepper. Other keys are ignored.
     */
    public OperationResponse addNoise(String sessionId, NoiseType type, RequestParameters params) {
        ImageProcessor processor = switch (type) {
            case GAUSSIAN -> noise.gaussianProcessor(
                    params.getDouble("mean", DEFAULT_MEAN),
                    params.getDouble("sigma", DEFAULT_SIGMA));
            case UNIFORM -> noise.uniformProcessor(
                    params.getDouble("low", DEFAULT_LOW),
                    params.getDouble("high", DEFAULT_HIGH));
            case SALT_PEPPER -> noise.saltAndPepperProcessor(
                    params.getDouble("ratio", DEFAULT_RATIO),
                    params.getDouble("salt_vs_pepper", NoiseSynthesizer.EQUAL_SALT_PEPPER));
        };
        Image result = sessions.mutate(sessionId, processor);
        return sessionResponse(sessionId, type.wireName() + " noise added successfully", result).build();
    }

    public OperationResponse applyFilter(String sessionId, SpatialFilterType type, int kernelSize, double sigma) {
        ImageProcessor processor = spatialFilters.processor(type, kernelSize, sigma);
        Image result = sessions.mutate(sessionId, processor);
        return sessionResponse(sessionId, type.wireName() + " filter applied", result).build();
    }

    /**
     * @param range only read for normalization; may be null otherwise
     */
    public OperationResponse enhance(String sessionId, EnhancementType type, NormalizationRange range) {
        if (type == EnhancementType.NORMALIZATION) {
            // validated before the session is locked
            enhancement.processor(type, range);
            AtomicReference<NormalizationResult> normalized = new AtomicReference<>();
            Image result = sessions.mutate(sessionId, input -> {
                NormalizationResult r = enhancement.normalize(input, range);
                normalized.set(r);
                return r.image();
            });
            return sessionResponse(sessionId, type.wireName() + " applied successfully", result)
                    .unitSamples(normalized.get().unitSamples())
                    .build();
        }
        ImageProcessor processor = enhancement.processor(type, range);
        Image result = sessions.mutate(sessionId, input -> Mats.expandChannels(processor.process(input), input.channels()));
        return sessionResponse(sessionId, type.wireName() + " applied successfully", result).build();
    }

    private OperationResponse enhanceFromParams(String sessionId, RequestParameters params) {
        EnhancementType type = EnhancementType.fromWireName(params.requireString("enhance_type"));
        NormalizationRange range = type == EnhancementType.NORMALIZATION
                ? NormalizationRange.fromWireName(params.getString("range_type", NormalizationRange.ZERO_TO_ONE.wireName()))
                : null;
        return enhance(sessionId, type, range);
    }

    /**
     * The session keeps its channel count: the filtered luma is replicated back when the
     * working image is color. The spectra and mask come back alongside.
     */
    public OperationResponse frequencyFilter(String sessionId, FrequencyFilterType type, int cutoff) {
        if (type == null) {
            throw new ValidationException("filter_type is required");
        }
        AtomicReference<FrequencyResult> filtered = new AtomicReference<>();
        Image result = sessions.mutate(sessionId, input -> {
            FrequencyResult r = frequency.apply(input, type, cutoff);
            filtered.set(r);
            return Mats.expandChannels(r.filtered(), input.channels());
        });
        FrequencyResult artifacts = filtered.get();
        return sessionResponse(sessionId, type.wireName() + "-pass filter applied", result)
                .image(OperationResponse.SPECTRUM, artifacts.spectrum())
                .image(OperationResponse.MASK, artifacts.mask())
                .image(OperationResponse.FILTERED_SPECTRUM, artifacts.filteredSpectrum())
                .effectiveCutoff(artifacts.effectiveCutoff())
                .build();
    }

    // ===== Analysis =====

    public OperationResponse detectEdges(String sessionId, EdgeOperator operator, double threshold1, double threshold2) {
        if (operator == null) {
            throw new ValidationException("edge_type is required");
        }
        EdgeResult result = edges.detect(sessions.working(sessionId), operator, threshold1, threshold2);
        OperationResponse.Builder response = OperationResponse.builder(operator.wireName() + " edge detection applied")
                .sessionId(sessionId)
                .layout(result.layout());
        switch (result.layout()) {
            case MULTI -> response
                    .image(OperationResponse.MAGNITUDE, result.magnitude())
                    .image(OperationResponse.GRAD_X, result.gradX())
                    .image(OperationResponse.GRAD_Y, result.gradY());
            case SINGLE -> response.image(OperationResponse.EDGES, result.edges());
        }
        return response.build();
    }

    public OperationResponse histogram(String sessionId, HistogramType type) {
        if (type == null) {
            throw new ValidationException("hist_type is required");
        }
        HistogramResult result = histograms.analyze(sessions.working(sessionId), type);
        return OperationResponse.builder(type.wireName() + " histogram computed")
                .sessionId(sessionId)
                .histogram(result)
                .build();
    }

    // ===== Stateless =====

    public OperationResponse hybrid(Image image1, Image image2, int cutoffLow, int cutoffHigh) {
        if (image1 == null || image2 == null) {
            throw new ValidationException("hybrid requires two images");
        }
        HybridResult result = hybrid.compose(image1, image2, cutoffLow, cutoffHigh);
        return OperationResponse.builder("Hybrid image created successfully")
                .image(OperationResponse.HYBRID, result.hybrid())
                .image(OperationResponse.LOW_FREQ, result.lowFrequency())
                .image(OperationResponse.HIGH_FREQ, result.highFrequency())
                .build();
    }

    private static OperationResponse.Builder sessionResponse(String sessionId, String message, Image working) {
        return OperationResponse.builder(message)
                .sessionId(sessionId)
                .image(OperationResponse.RESULT, working);
    }
}
