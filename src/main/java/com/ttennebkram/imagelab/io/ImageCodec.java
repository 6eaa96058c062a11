package com.ttennebkram.imagelab.io;

import com.ttennebkram.imagelab.DecodeException;
import com.ttennebkram.imagelab.ImageLabException;
import com.ttennebkram.imagelab.model.Image;
import com.ttennebkram.imagelab.util.Mats;
import com.ttennebkram.imagelab.util.OpenCvLoader;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;

import java.util.Base64;

/**
 * Compressed bytes to and from {@link Image}, for whatever transport sits in front of the engine.
 *
 * OpenCV decodes to BGR; images inside the engine are RGB, so color is swapped on the way
 * in and out. Alpha is dropped, 16-bit input is scaled down to 8 bits.
 */
public class ImageCodec {

    public static final String PNG = ".png";

    public ImageCodec() {
        OpenCvLoader.ensureLoaded();
    }

    /**
     * @throws DecodeException if the bytes are empty or not a format OpenCV can read
     */
    public Image decode(byte[] data) {
        if (data == null || data.length == 0) {
            throw new DecodeException("Image data is empty");
        }
        MatOfByte buffer = new MatOfByte(data);
        Mat decoded = null;
        Mat eightBit = new Mat();
        Mat rgb = new Mat();
        try {
            decoded = Imgcodecs.imdecode(buffer, Imgcodecs.IMREAD_UNCHANGED);
            if (decoded == null || decoded.empty()) {
                throw new DecodeException("Could not decode image (" + data.length + " bytes)");
            }
            if (decoded.depth() == CvType.CV_16U) {
                decoded.convertTo(eightBit, CvType.CV_8U, 1.0 / 257.0);
            } else if (decoded.depth() == CvType.CV_8U) {
                decoded.copyTo(eightBit);
            } else {
                throw new DecodeException("Unsupported sample depth " + CvType.typeToString(decoded.type()));
            }
            switch (eightBit.channels()) {
                case 1 -> eightBit.copyTo(rgb);
                case 3 -> Imgproc.cvtColor(eightBit, rgb, Imgproc.COLOR_BGR2RGB);
                case 4 -> Imgproc.cvtColor(eightBit, rgb, Imgproc.COLOR_BGRA2RGB);
                default -> throw new DecodeException("Unsupported channel count " + eightBit.channels());
            }
            return Mats.toImage(rgb);
        } finally {
            Mats.release(buffer, decoded, eightBit, rgb);
        }
    }

    /**
     * Decode a base64 string, as images arrive inside JSON requests.
     */
    public Image decodeBase64(String encoded) {
        if (encoded == null || encoded.isEmpty()) {
            throw new DecodeException("Image data is empty");
        }
        byte[] data;
        try {
            data = Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new DecodeException("Image data is not valid base64", e);
        }
        return decode(data);
    }

    /**
     * Encode as PNG.
     */
    public byte[] encode(Image image) {
        return encode(image, PNG);
    }

    /**
     * @param extension an OpenCV encoder extension such as ".png" or ".jpg"
     */
    public byte[] encode(Image image, String extension) {
        Mat src = Mats.toMat(image);
        Mat bgr = new Mat();
        MatOfByte buffer = new MatOfByte();
        try {
            if (image.channels() == 3) {
                Imgproc.cvtColor(src, bgr, Imgproc.COLOR_RGB2BGR);
            } else {
                src.copyTo(bgr);
            }
            if (!Imgcodecs.imencode(extension, bgr, buffer)) {
                throw new ImageLabException("Could not encode image as " + extension);
            }
            return buffer.toArray();
        } finally {
            Mats.release(src, bgr, buffer);
        }
    }

    public String encodeBase64(Image image) {
        return Base64.getEncoder().encodeToString(encode(image));
    }
}
