package com.schemadoc.resolver.parser;

import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemadoc.resolver.model.ObjectKind;
import com.schemadoc.resolver.model.ObjectPath;

/**
 * Splits a dotted object identifier into an {@link ObjectPath}.
 *
 * The caller states whether the identifier names a method or a function; no naming
 * heuristics are applied. The last token is the member, for methods the token before
 * it is the class, the first remaining token is the package and the rest are path
 * segments. Empty tokens are kept so that the identifier round-trips.
 */
public class ObjectPathParser {
    private static final Logger log = LoggerFactory.getLogger(ObjectPathParser.class);

    public ObjectPath parse(String identifier, ObjectKind kind) {
        if (identifier == null || identifier.isEmpty()) {
            throw new MalformedIdentifierException(identifier, "Object identifier must not be empty");
        }
        ObjectKind effectiveKind = kind != null ? kind : ObjectKind.FUNCTION;

        // limit -1 keeps trailing empty tokens ("a." -> ["a", ""])
        List<String> tokens = Arrays.asList(identifier.split("\\.", -1));
        int last = tokens.size() - 1;

        ObjectPath.ObjectPathBuilder builder = ObjectPath.builder().memberName(tokens.get(last));
        if (tokens.size() == 1) {
            if (effectiveKind == ObjectKind.METHOD) {
                log.debug("Identifier '{}' has no class token, treating it as a bare member", identifier);
            }
            return builder.build();
        }

        int leadingEnd = last;
        if (effectiveKind == ObjectKind.METHOD) {
            builder.className(tokens.get(last - 1));
            leadingEnd = last - 1;
        }

        if (leadingEnd > 0) {
            builder.packageName(tokens.get(0));
            builder.pathSegments(tokens.subList(1, leadingEnd));
        }

        ObjectPath path = builder.build();
        log.debug("Parsed {} '{}' -> package={}, segments={}, class={}, member={}", effectiveKind, identifier,
                path.getPackageName(), path.getPathSegments(), path.getClassName(), path.getMemberName());
        return path;
    }

    public ObjectPath parseFunction(String identifier) {
        return parse(identifier, ObjectKind.FUNCTION);
    }

    public ObjectPath parseMethod(String identifier) {
        return parse(identifier, ObjectKind.METHOD);
    }
}
