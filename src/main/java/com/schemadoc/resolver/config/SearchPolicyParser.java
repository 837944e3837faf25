package com.schemadoc.resolver.config;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemadoc.resolver.model.PathSeparator;
import com.schemadoc.resolver.model.SearchPolicy;

/**
 * Builds a {@link SearchPolicy} from a raw configuration block.
 *
 * Format (YAML shown):
 * <pre>
 * search_policy:
 *   include_package_name: false
 *   include_path_to_file: true
 *   path_to_file_separator: "."     # ".", "/" or "none"
 *   path_to_class_separator: "."
 *   custom_patterns:
 *     - "{class_name}_{method_name}"
 * </pre>
 * Missing keys take the policy defaults. Unrecognized separators fall back to DOT.
 */
public class SearchPolicyParser {
    private static final Logger log = LoggerFactory.getLogger(SearchPolicyParser.class);

    public static final String INCLUDE_PACKAGE_NAME = "include_package_name";
    public static final String INCLUDE_PATH_TO_FILE = "include_path_to_file";
    public static final String PATH_TO_FILE_SEPARATOR = "path_to_file_separator";
    public static final String PATH_TO_CLASS_SEPARATOR = "path_to_class_separator";
    public static final String CUSTOM_PATTERNS = "custom_patterns";

    public SearchPolicy parse(Object raw) {
        if (!(raw instanceof Map<?, ?> block)) {
            if (raw != null) {
                log.warn("search_policy must be a mapping, got {}; using defaults", raw.getClass().getSimpleName());
            }
            return SearchPolicy.defaults();
        }

        SearchPolicy.SearchPolicyBuilder builder = SearchPolicy.builder()
                .includePackageName(parseBoolean(block.get(INCLUDE_PACKAGE_NAME), INCLUDE_PACKAGE_NAME, false))
                .includePathToFile(parseBoolean(block.get(INCLUDE_PATH_TO_FILE), INCLUDE_PATH_TO_FILE, true))
                .pathToFileSeparator(parseSeparator(block.get(PATH_TO_FILE_SEPARATOR), PATH_TO_FILE_SEPARATOR))
                .pathToClassSeparator(parseSeparator(block.get(PATH_TO_CLASS_SEPARATOR), PATH_TO_CLASS_SEPARATOR));

        Object patterns = block.get(CUSTOM_PATTERNS);
        if (patterns instanceof List<?> list) {
            for (Object pattern : list) {
                if (pattern == null) {
                    continue;
                }
                builder.customPattern(String.valueOf(pattern));
            }
        } else if (patterns instanceof String single) {
            builder.customPattern(single);
        } else if (patterns != null) {
            throw new ConfigurationException(CUSTOM_PATTERNS + " must be a list of strings");
        }

        return builder.build();
    }

    PathSeparator parseSeparator(Object raw, String key) {
        if (raw == null) {
            return PathSeparator.DOT;
        }
        String token = String.valueOf(raw);
        return PathSeparator.fromToken(token).orElseGet(() -> {
            log.warn("Unknown {} '{}', falling back to '.'", key, token);
            return PathSeparator.DOT;
        });
    }

    /**
     * Accepts YAML booleans and the strings "true"/"false" in any case; anything else is rejected.
     */
    boolean parseBoolean(Object raw, String key, boolean defaultValue) {
        if (raw == null) {
            return defaultValue;
        }
        if (raw instanceof Boolean b) {
            return b;
        }
        String text = String.valueOf(raw).trim();
        if ("true".equalsIgnoreCase(text)) {
            return true;
        }
        if ("false".equalsIgnoreCase(text)) {
            return false;
        }
        throw new ConfigurationException(key + " must be true or false. Got: " + raw);
    }
}
