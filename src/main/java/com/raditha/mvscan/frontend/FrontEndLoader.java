package com.raditha.mvscan.frontend;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a compilation unit exported by the front-end as JSON.
 * Unknown properties are ignored so richer exports stay loadable.
 */
public class FrontEndLoader {

    private static final Logger logger = LoggerFactory.getLogger(FrontEndLoader.class);

    private final ObjectMapper mapper;

    public FrontEndLoader() {
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Load a compilation unit from a JSON file.
     *
     * @param exportFile front-end export
     * @return parsed compilation unit
     * @throws IOException if the file cannot be read or is not a valid export
     */
    public CompilationUnitModel load(Path exportFile) throws IOException {
        if (!Files.isRegularFile(exportFile)) {
            throw new IOException("Front-end export not found: " + exportFile);
        }
        try (InputStream in = Files.newInputStream(exportFile)) {
            CompilationUnitModel unit = read(in);
            logger.info("Loaded {} contracts ({} functions) from {}",
                    unit.contracts().size(), unit.functions().count(), exportFile);
            return unit;
        }
    }

    /**
     * Load a compilation unit from a stream (used for classpath fixtures).
     */
    public CompilationUnitModel read(InputStream in) throws IOException {
        return mapper.readValue(in, CompilationUnitModel.class);
    }
}
