package com.blockmorph.morph;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class MorphSettings {

    public static final int DEFAULT_CELL_SIZE = 32;
    public static final double DEFAULT_GRADIENT_WEIGHT = 0.7d;
    public static final int DEFAULT_DURATION_MS = 2000;
    public static final int DEFAULT_FPS = 30;

    private static final int SERIALIZED_PARTS = 4;

    private final int cellSize;
    private final double gradientWeight;
    private final int targetDurationMs;
    private final int nominalFps;
    private final Integer progressLogPercentStep;

    private MorphSettings(Builder builder) {
        this.cellSize = builder.cellSize;
        this.gradientWeight = builder.gradientWeight;
        this.targetDurationMs = builder.targetDurationMs;
        this.nominalFps = builder.nominalFps;
        this.progressLogPercentStep = builder.progressLogPercentStep;
    }

    public int cellSize() {
        return cellSize;
    }

    public double gradientWeight() {
        return gradientWeight;
    }

    public int targetDurationMs() {
        return targetDurationMs;
    }

    public int nominalFps() {
        return nominalFps;
    }

    public Integer progressLogPercentStep() {
        return progressLogPercentStep;
    }

    public Builder toBuilder() {
        return builder()
                .cellSize(cellSize)
                .gradientWeight(gradientWeight)
                .targetDurationMs(targetDurationMs)
                .nominalFps(nominalFps)
                .progressLogPercentStep(progressLogPercentStep);
    }

    public String serialize() {
        List<String> parts = new ArrayList<>(SERIALIZED_PARTS);
        parts.add(Integer.toString(cellSize));
        parts.add(Double.toString(gradientWeight));
        parts.add(Integer.toString(targetDurationMs));
        parts.add(Integer.toString(nominalFps));
        return String.join("_", parts);
    }

    public static MorphSettings deserialize(String serialized) {
        Objects.requireNonNull(serialized, "serialized");
        String[] parts = serialized.split("_", -1);
        if (parts.length != SERIALIZED_PARTS) {
            throw new IllegalArgumentException("Serialized settings must contain " + SERIALIZED_PARTS
                    + " parts but found " + parts.length);
        }
        return builder()
                .cellSize(parseInt(parts[0], "cell size"))
                .gradientWeight(parseDouble(parts[1], "gradient weight"))
                .targetDurationMs(parseInt(parts[2], "duration"))
                .nominalFps(parseInt(parts[3], "fps"))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static int parseInt(String value, String label) {
        try {
            return Integer.parseInt(requireToken(value, label));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid " + label + " value: '" + value + "'", ex);
        }
    }

    private static double parseDouble(String value, String label) {
        try {
            return Double.parseDouble(requireToken(value, label));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid " + label + " value: '" + value + "'", ex);
        }
    }

    private static String requireToken(String value, String label) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException(label + " is missing in serialized settings");
        }
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof MorphSettings other)) {
            return false;
        }
        return cellSize == other.cellSize
                && Double.compare(gradientWeight, other.gradientWeight) == 0
                && targetDurationMs == other.targetDurationMs
                && nominalFps == other.nominalFps;
    }

    @Override
    public int hashCode() {
        return Objects.hash(cellSize, gradientWeight, targetDurationMs, nominalFps);
    }

    @Override
    public String toString() {
        return serialize();
    }

    public static final class Builder {
        private int cellSize = DEFAULT_CELL_SIZE;
        private double gradientWeight = DEFAULT_GRADIENT_WEIGHT;
        private int targetDurationMs = DEFAULT_DURATION_MS;
        private int nominalFps = DEFAULT_FPS;
        private Integer progressLogPercentStep;

        public Builder cellSize(int cellSize) {
            if (cellSize <= 0) {
                throw new IllegalArgumentException("Cell size must be positive");
            }
            this.cellSize = cellSize;
            return this;
        }

        public Builder gradientWeight(double gradientWeight) {
            if (Double.isNaN(gradientWeight) || gradientWeight < 0.0 || gradientWeight > 1.0) {
                throw new IllegalArgumentException("Gradient weight must be between 0.0 and 1.0 inclusive");
            }
            this.gradientWeight = gradientWeight;
            return this;
        }

        public Builder targetDurationMs(int targetDurationMs) {
            if (targetDurationMs <= 0) {
                throw new IllegalArgumentException("Duration must be positive");
            }
            this.targetDurationMs = targetDurationMs;
            return this;
        }

        public Builder nominalFps(int nominalFps) {
            if (nominalFps <= 0) {
                throw new IllegalArgumentException("Fps must be positive");
            }
            this.nominalFps = nominalFps;
            return this;
        }

        public Builder progressLogPercentStep(Integer percentStep) {
            if (percentStep != null) {
                if (percentStep <= 0 || percentStep > 100) {
                    throw new IllegalArgumentException("Progress log percent step must be between 1 and 100");
                }
            }
            this.progressLogPercentStep = percentStep;
            return this;
        }

        public MorphSettings build() {
            return new MorphSettings(this);
        }
    }
}
