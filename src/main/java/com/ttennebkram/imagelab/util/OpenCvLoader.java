package com.ttennebkram.imagelab.util;

import java.util.logging.Logger;

/**
 * Loads the OpenCV native library bundled with the openpnp artifact.
 * Every class that allocates a Mat calls ensureLoaded() first; the load happens once per JVM.
 */
public final class OpenCvLoader {

    private static final Logger LOG = Logger.getLogger(OpenCvLoader.class.getName());

    private static volatile boolean loaded = false;

    private OpenCvLoader() {
    }

    public static void ensureLoaded() {
        if (loaded) {
            return;
        }
        synchronized (OpenCvLoader.class) {
            if (loaded) {
                return;
            }
            // loadShared() does not work on Java 12+, loadLocally() extracts to a temp dir
            nu.pattern.OpenCV.loadLocally();
            loaded = true;
            LOG.info("OpenCV version: " + org.opencv.core.Core.VERSION);
        }
    }
}
