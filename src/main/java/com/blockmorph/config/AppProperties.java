package com.blockmorph.config;

import com.blockmorph.morph.MorphSettings;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;

import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class AppProperties {

    private final String bindHost;
    private final int bindPort;
    private final MorphSettings defaultSettings;
    private final Path outputDirectory;

    public AppProperties(Environment environment) {
        BindAddress address = determineBindAddress(environment);
        this.bindHost = address.host();
        this.bindPort = address.port();
        this.defaultSettings = determineDefaultSettings(environment);
        String output = resolveOptional(environment, "app.output-directory", "MORPH_OUTPUT_DIR");
        this.outputDirectory = StringUtils.hasText(output) ? Path.of(output) : Path.of("");
    }

    public String getBindHost() {
        return bindHost;
    }

    public int getBindPort() {
        return bindPort;
    }

    public MorphSettings getDefaultSettings() {
        return defaultSettings;
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    public InetAddress getBindAddress() {
        try {
            return InetAddress.getByName(bindHost);
        } catch (UnknownHostException ex) {
            throw new IllegalStateException("Failed to resolve bind host: " + bindHost, ex);
        }
    }

    private MorphSettings determineDefaultSettings(Environment environment) {
        MorphSettings.Builder builder = MorphSettings.builder();
        try {
            Integer cellSize = resolveInteger(environment, "app.morph.cell-size", "MORPH_CELL_SIZE");
            if (cellSize != null) {
                builder.cellSize(cellSize);
            }
            String weight = resolveOptional(environment, "app.morph.gradient-weight", "MORPH_GRADIENT_WEIGHT");
            if (weight != null) {
                builder.gradientWeight(parseDouble(weight, "MORPH_GRADIENT_WEIGHT"));
            }
            Integer duration = resolveInteger(environment, "app.morph.duration-ms", "MORPH_DURATION_MS");
            if (duration != null) {
                builder.targetDurationMs(duration);
            }
            Integer fps = resolveInteger(environment, "app.morph.fps", "MORPH_FPS");
            if (fps != null) {
                builder.nominalFps(fps);
            }
            Integer progressStep = resolveInteger(environment, "app.morph.progress-log-step", "MORPH_PROGRESS_LOG_STEP");
            if (progressStep != null) {
                builder.progressLogPercentStep(progressStep);
            }
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException("Invalid morph configuration: " + ex.getMessage(), ex);
        }
        return builder.build();
    }

    private Integer resolveInteger(Environment environment, String propertyKey, String envKey) {
        String value = resolveOptional(environment, propertyKey, envKey);
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException ex) {
            throw new IllegalStateException("Invalid integer value for " + envKey + ": " + value, ex);
        }
    }

    private double parseDouble(String value, String envKey) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException ex) {
            throw new IllegalStateException("Invalid number value for " + envKey + ": " + value, ex);
        }
    }

    private String resolveOptional(Environment environment, String propertyKey, String envKey) {
        String value = environment.getProperty(propertyKey);
        if (StringUtils.hasText(value)) {
            return value.trim();
        }
        value = environment.getProperty(envKey);
        return StringUtils.hasText(value) ? value.trim() : null;
    }

    private BindAddress determineBindAddress(Environment environment) {
        String bindRaw = resolveOptional(environment, "app.bind-address", "APP_BIND_ADDR");
        String defaultHost = "0.0.0.0";
        int defaultPort = 3000;

        if (StringUtils.hasText(bindRaw)) {
            String[] parts = bindRaw.split(":", 2);
            if (parts.length != 2 || !StringUtils.hasText(parts[0]) || !StringUtils.hasText(parts[1])) {
                throw new IllegalStateException("APP_BIND_ADDR must follow host:port format");
            }
            int port = parsePort(parts[1]);
            return new BindAddress(parts[0].trim(), port);
        }

        String portValue = resolveOptional(environment, "server.port", "PORT");
        if (StringUtils.hasText(portValue)) {
            int port = parsePort(portValue);
            return new BindAddress(defaultHost, port);
        }

        return new BindAddress(defaultHost, defaultPort);
    }

    private int parsePort(String value) {
        try {
            int port = Integer.parseInt(value.trim());
            if (port <= 0 || port > 65535) {
                throw new IllegalArgumentException();
            }
            return port;
        } catch (Exception ex) {
            throw new IllegalStateException("Invalid port value: " + value, ex);
        }
    }

    private record BindAddress(String host, int port) {}
}
