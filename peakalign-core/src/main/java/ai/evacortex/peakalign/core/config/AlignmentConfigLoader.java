/*
 * PeakAlign — Reference-Peak Signal Alignment Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.peakalign.core.config;

import ai.evacortex.peakalign.core.engine.AlignmentConfig;
import ai.evacortex.peakalign.core.exceptions.InvalidAlignmentConfigException;
import ai.evacortex.peakalign.core.math.InterpolationMethod;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Reads and writes {@link AlignmentConfig} as JSON.
 *
 * <p>Keys may be camelCase or snake_case ({@code grid_steps}, {@code shift_range}, ...). Missing keys keep
 * their defaults and unknown keys are ignored. The values go through the same validation as
 * {@link AlignmentConfig.Builder#build()}.</p>
 */
public final class AlignmentConfigLoader {

    // counts must be written as integers, 2.5 iterations is an error rather than 2
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static final class ConfigDocument {
        public Integer iterations;
        public Integer resolution;

        @JsonAlias({"grid_steps"})
        public Integer gridSteps;

        public Double ratio;

        @JsonAlias({"shift_range"})
        public double[] shiftRange;

        @JsonAlias({"only_shift"})
        public Boolean onlyShift;

        @JsonAlias({"align_by_index"})
        public Boolean alignByIndex;

        public String method;

        @JsonAlias({"return_shifts"})
        public Boolean returnShifts;

        @JsonAlias({"peak_width", "peakWidth"})
        public Double width;

        @JsonAlias({"quick_shift"})
        public Boolean quickShift;
    }

    private AlignmentConfigLoader() {}

    public static AlignmentConfig load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read alignment config " + path, e);
        }
    }

    public static AlignmentConfig load(InputStream in) {
        try {
            return toConfig(MAPPER.readValue(in, ConfigDocument.class));
        } catch (JsonProcessingException e) {
            throw new InvalidAlignmentConfigException("malformed JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read alignment config", e);
        }
    }

    public static AlignmentConfig fromJson(String json) {
        try {
            return toConfig(MAPPER.readValue(json, ConfigDocument.class));
        } catch (JsonProcessingException e) {
            throw new InvalidAlignmentConfigException("malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static String toJson(AlignmentConfig config) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toDocument(config));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize alignment config", e);
        }
    }

    /** Writes {@code config} to {@code path}, creating parent directories and replacing any existing file. */
    public static void save(AlignmentConfig config, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(path, StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING)) {
                MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, toDocument(config));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write alignment config " + path, e);
        }
    }

    static AlignmentConfig toConfig(ConfigDocument doc) {
        if (doc == null) {
            throw new InvalidAlignmentConfigException("empty document");
        }
        AlignmentConfig.Builder b = AlignmentConfig.builder();
        if (doc.iterations != null) b.iterations(doc.iterations);
        if (doc.resolution != null) b.resolution(doc.resolution);
        if (doc.gridSteps != null) b.gridSteps(doc.gridSteps);
        if (doc.ratio != null) b.ratio(doc.ratio);
        if (doc.shiftRange != null) b.shiftRange(doc.shiftRange);
        if (doc.onlyShift != null) b.onlyShift(doc.onlyShift);
        if (doc.alignByIndex != null) b.alignByIndex(doc.alignByIndex);
        if (doc.method != null) b.method(InterpolationMethod.fromName(doc.method));
        if (doc.returnShifts != null) b.returnShifts(doc.returnShifts);
        if (doc.width != null) b.width(doc.width);
        if (doc.quickShift != null) b.quickShift(doc.quickShift);
        return b.build();
    }

    static ConfigDocument toDocument(AlignmentConfig config) {
        ConfigDocument doc = new ConfigDocument();
        doc.iterations = config.iterations();
        doc.resolution = config.resolution();
        doc.gridSteps = config.gridSteps();
        doc.ratio = config.ratio();
        doc.shiftRange = new double[]{config.shiftMin(), config.shiftMax()};
        doc.onlyShift = config.onlyShift();
        doc.alignByIndex = config.alignByIndex();
        doc.method = config.method().id();
        doc.returnShifts = config.returnShifts();
        doc.width = config.width();
        doc.quickShift = config.quickShift();
        return doc;
    }
}
