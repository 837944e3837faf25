package com.schemadoc.resolver.pattern;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.schemadoc.resolver.model.FileKind;
import com.schemadoc.resolver.model.ObjectPath;

/**
 * Renders user-supplied file name templates against an {@link ObjectPath}.
 *
 * Supported placeholders:
 * - {object_name}: full dotted identifier
 * - {class_name}: class name, or empty for functions
 * - {method_name}: member name
 * - {package_name}: package and path segments, dot-joined
 *
 * Unknown placeholders are left as written.
 */
public class CustomPatternRenderer {

    public static final String OBJECT_NAME = "{object_name}";
    public static final String CLASS_NAME = "{class_name}";
    public static final String METHOD_NAME = "{method_name}";
    public static final String PACKAGE_NAME = "{package_name}";

    // Single pass, so substituted values are never re-scanned
    private static final Pattern PLACEHOLDER = Pattern.compile(
            "\\{(object_name|class_name|method_name|package_name)\\}");

    /**
     * Substitutes all placeholders in the template.
     */
    public String render(String template, ObjectPath path) {
        if (template == null) {
            return "";
        }
        Map<String, String> values = placeholderValues(path);
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder rendered = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(rendered, Matcher.quoteReplacement(values.get(matcher.group())));
        }
        matcher.appendTail(rendered);
        return rendered.toString();
    }

    /**
     * Renders the template and removes a trailing kind suffix, so that templates written
     * as complete file names still yield a stem.
     */
    public String renderStem(String template, ObjectPath path) {
        return stripKindSuffix(render(template, path));
    }

    static String stripKindSuffix(String name) {
        // SCHEMA first: ".schema.json" also ends with ".json"
        for (FileKind kind : FileKind.values()) {
            if (name.endsWith(kind.getSuffix())) {
                return name.substring(0, name.length() - kind.getSuffix().length());
            }
        }
        return name;
    }

    private Map<String, String> placeholderValues(ObjectPath path) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put(OBJECT_NAME, path.toIdentifier());
        values.put(CLASS_NAME, path.hasClass() ? path.getClassName() : "");
        values.put(METHOD_NAME, path.getMemberName());
        values.put(PACKAGE_NAME, path.getQualifiedPackage());
        return values;
    }
}
