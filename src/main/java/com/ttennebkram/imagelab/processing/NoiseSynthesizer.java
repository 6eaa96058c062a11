package com.ttennebkram.imagelab.processing;

import com.ttennebkram.imagelab.ValidationException;
import com.ttennebkram.imagelab.model.Image;
import com.ttennebkram.imagelab.util.Mats;
import com.ttennebkram.imagelab.util.OpenCvLoader;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.util.Random;

/**
 * Additive and impulse noise generators.
 *
 * Additive noise is drawn per channel per pixel, added in float, then rounded and
 * saturated back to 8 bits. Impulse noise picks whole pixels, so an affected pixel's
 * channels move together.
 */
public class NoiseSynthesizer {

    /** Salt probability used when the caller does not specify one. */
    public static final double EQUAL_SALT_PEPPER = 0.5;

    private final Random random;

    public NoiseSynthesizer(Random random) {
        OpenCvLoader.ensureLoaded();
        this.random = random;
    }

    public NoiseSynthesizer() {
        this(new Random());
    }

    // ===== Validated processors =====

    public ImageProcessor gaussianProcessor(double mean, double sigma) {
        validateGaussian(mean, sigma);
        return input -> gaussian(input, mean, sigma);
    }

    public ImageProcessor uniformProcessor(double low, double high) {
        validateUniform(low, high);
        return input -> uniform(input, low, high);
    }

    public ImageProcessor saltAndPepperProcessor(double ratio, double saltProbability) {
        validateSaltAndPepper(ratio, saltProbability);
        return input -> saltAndPepper(input, ratio, saltProbability);
    }

    // ===== Operations =====

    /**
     * Add N(mean, sigma) to every sample. sigma == 0 returns the input unchanged.
     */
    public Image gaussian(Image image, double mean, double sigma) {
        validateGaussian(mean, sigma);
        if (sigma == 0.0) {
            return image;
        }
        float[] noise = new float[image.pixelCount() * image.channels()];
        synchronized (random) {
            for (int i = 0; i < noise.length; i++) {
                noise[i] = (float) (mean + sigma * random.nextGaussian());
            }
        }
        return addNoise(image, noise);
    }

    /**
     * Add U(low, high) to every sample.
     */
    public Image uniform(Image image, double low, double high) {
        validateUniform(low, high);
        float[] noise = new float[image.pixelCount() * image.channels()];
        double span = high - low;
        synchronized (random) {
            for (int i = 0; i < noise.length; i++) {
                noise[i] = (float) (low + span * random.nextDouble());
            }
        }
        return addNoise(image, noise);
    }

    public Image saltAndPepper(Image image, double ratio) {
        return saltAndPepper(image, ratio, EQUAL_SALT_PEPPER);
    }

    /**
     * Force a ratio fraction of pixels to 255 (salt, with probability saltProbability) or 0 (pepper).
     * Each pixel is selected independently.
     */
    public Image saltAndPepper(Image image, double ratio, double saltProbability) {
        validateSaltAndPepper(ratio, saltProbability);
        byte[] samples = image.toByteArray();
        if (ratio == 0.0) {
            return Image.of(image.rows(), image.cols(), image.channels(), samples);
        }
        int channels = image.channels();
        synchronized (random) {
            for (int p = 0; p < image.pixelCount(); p++) {
                if (random.nextDouble() >= ratio) {
                    continue;
                }
                byte value = random.nextDouble() < saltProbability ? (byte) 255 : (byte) 0;
                for (int c = 0; c < channels; c++) {
                    samples[p * channels + c] = value;
                }
            }
        }
        return Image.of(image.rows(), image.cols(), channels, samples);
    }

    private Image addNoise(Image image, float[] noise) {
        Mat src = Mats.toMat(image);
        Mat work = new Mat();
        Mat noiseMat = new Mat(image.rows(), image.cols(), CvType.CV_32FC(image.channels()));
        Mat output = new Mat();
        try {
            noiseMat.put(0, 0, noise);
            src.convertTo(work, CvType.CV_32F);
            Core.add(work, noiseMat, work);
            // convertTo rounds and saturates to [0, 255]
            work.convertTo(output, CvType.CV_8U);
            return Mats.toImage(output);
        } finally {
            Mats.release(src, work, noiseMat, output);
        }
    }

    // ===== Validation =====

    static void validateGaussian(double mean, double sigma) {
        requireFinite("mean", mean);
        requireFinite("sigma", sigma);
        if (sigma < 0) {
            throw new ValidationException("sigma must be >= 0, got " + sigma);
        }
    }

    static void validateUniform(double low, double high) {
        requireFinite("low", low);
        requireFinite("high", high);
        if (low > high) {
            throw new ValidationException("low must not exceed high, got low=" + low + " high=" + high);
        }
    }

    static void validateSaltAndPepper(double ratio, double saltProbability) {
        requireFinite("ratio", ratio);
        requireFinite("salt_vs_pepper", saltProbability);
        if (ratio < 0 || ratio > 1) {
            throw new ValidationException("ratio must be in [0, 1], got " + ratio);
        }
        if (saltProbability < 0 || saltProbability > 1) {
            throw new ValidationException("salt_vs_pepper must be in [0, 1], got " + saltProbability);
        }
    }

    private static void requireFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new ValidationException(name + " must be a finite number, got " + value);
        }
    }
}
