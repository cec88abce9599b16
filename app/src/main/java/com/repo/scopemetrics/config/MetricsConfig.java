package com.repo.scopemetrics.config;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Configuration for Scope Metrics analysis.
 * Loaded from scope-metrics.yaml in project root or uses sensible defaults.
 *
 * <pre>
 * rules:
 *   complexity: 20                  # or { max: 20, variant: classic }, or off
 *   max-statements:
 *     max: 10
 *     ignoreTopLevelFunctions: false
 * exclusions:
 *   - "**&#47;node_modules/**"
 * </pre>
 */
public class MetricsConfig {

    public static final String FILE_NAME = "scope-metrics.yaml";
    public static final String COMPLEXITY = "complexity";
    public static final String MAX_STATEMENTS = "max-statements";

    // Rule options; null when the rule is switched off
    private ComplexityOptions complexity = ComplexityOptions.defaults();
    private StatementOptions maxStatements = StatementOptions.defaults();

    // Exclusion patterns
    private Set<String> exclusions = Set.of("**/node_modules/**", "**/vendor/**", "**/dist/**");

    /**
     * Load configuration from scope-metrics.yaml in the given directory, or return defaults.
     */
    public static MetricsConfig load(Path projectRoot) {
        Path configFile = projectRoot.resolve(FILE_NAME);
        if (Files.exists(configFile)) {
            try {
                return loadFile(configFile);
            } catch (ConfigurationException e) {
                if (e.getCause() instanceof IOException) {
                    System.err.println("Warning: Could not read config file, using defaults: " + e.getMessage());
                    return defaults();
                }
                throw e;
            }
        }
        return defaults();
    }

    /**
     * Load configuration from an explicit YAML file.
     */
    public static MetricsConfig loadFile(Path configFile) {
        if (!Files.isRegularFile(configFile)) {
            throw new ConfigurationException("Config file not found: " + configFile);
        }
        try (InputStream is = Files.newInputStream(configFile)) {
            Object data = new Yaml().load(is);
            MetricsConfig config = fromYaml(data, configFile.toString());
            System.out.println("Loaded configuration from: " + configFile);
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Could not read " + configFile + ": " + e.getMessage(), e);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed YAML in " + configFile + ": " + e.getMessage(), e);
        }
    }

    /**
     * Default configuration.
     */
    public static MetricsConfig defaults() {
        return new MetricsConfig();
    }

    /**
     * Build configuration from an already-parsed YAML document.
     */
    public static MetricsConfig fromMap(Map<String, Object> data) {
        MetricsConfig config = new MetricsConfig();
        config.parseYaml(data);
        return config;
    }

    @SuppressWarnings("unchecked")
    private static MetricsConfig fromYaml(Object data, String source) {
        if (data == null) {
            return defaults();
        }
        if (!(data instanceof Map)) {
            throw new ConfigurationException(source + " must contain a mapping at the top level");
        }
        return fromMap((Map<String, Object>) data);
    }

    private void parseYaml(Map<String, Object> data) {
        // Parse rules
        Object rules = data.get("rules");
        if (rules != null) {
            if (!(rules instanceof Map)) {
                throw new ConfigurationException("'rules' must be a mapping of rule id to options");
            }
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) rules).entrySet()) {
                parseRule(String.valueOf(entry.getKey()), entry.getValue());
            }
        }

        // Parse exclusions
        Object exclusionList = data.get("exclusions");
        if (exclusionList instanceof List) {
            List<?> excList = (List<?>) exclusionList;
            if (!excList.isEmpty()) {
                Set<String> parsed = new LinkedHashSet<>();
                excList.forEach(e -> parsed.add(String.valueOf(e)));
                exclusions = parsed;
            }
        } else if (exclusionList != null) {
            throw new ConfigurationException("'exclusions' must be a list of glob patterns");
        }
    }

    private void parseRule(String ruleId, Object option) {
        boolean off = isOff(option);
        Object effective = Boolean.TRUE.equals(option) || "on".equals(option) ? null : option;
        switch (ruleId) {
            case COMPLEXITY -> complexity = off ? null : ComplexityOptions.parse(effective);
            case MAX_STATEMENTS -> maxStatements = off ? null : StatementOptions.parse(effective);
            default -> throw new ConfigurationException("Unknown rule: " + ruleId
                    + " (known: " + COMPLEXITY + ", " + MAX_STATEMENTS + ")");
        }
    }

    // YAML 1.1 reads a bare off as false
    private static boolean isOff(Object option) {
        return Boolean.FALSE.equals(option) || "off".equals(option);
    }

    // === Getters ===

    public Optional<ComplexityOptions> complexity() {
        return Optional.ofNullable(complexity);
    }

    public Optional<StatementOptions> maxStatements() {
        return Optional.ofNullable(maxStatements);
    }

    public Set<String> getExclusions() {
        return exclusions;
    }

    public boolean shouldExclude(Path path) {
        String pathStr = path.toString().replace('\\', '/');
        for (String pattern : exclusions) {
            if (matchesGlob(pathStr, pattern)) {
                return true;
            }
        }
        return false;
    }

    private boolean matchesGlob(String path, String glob) {
        String regex = glob
                .replace(".", "\\.")
                .replace("**", "<<<DOUBLESTAR>>>")
                .replace("*", "[^/]*")
                .replace("<<<DOUBLESTAR>>>", ".*");
        return path.matches(".*" + regex + ".*");
    }

    public MetricsConfig withComplexity(ComplexityOptions options) {
        this.complexity = options;
        return this;
    }

    public MetricsConfig withMaxStatements(StatementOptions options) {
        this.maxStatements = options;
        return this;
    }
}
