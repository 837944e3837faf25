package com.schemadoc.resolver.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.schemadoc.resolver.cli.exception.OptionsValidationException;
import com.schemadoc.resolver.cli.exception.OptionsValidationException.OptionError;
import com.schemadoc.resolver.cli.model.LookupCliOptions;
import com.schemadoc.resolver.cli.model.ValidatedLookupOptions;
import com.schemadoc.resolver.config.ConfigurationException;
import com.schemadoc.resolver.config.ResolverConfig;
import com.schemadoc.resolver.config.ResolverConfigLoader;
import com.schemadoc.resolver.model.LookupOptions;
import com.schemadoc.resolver.model.ObjectKind;
import com.schemadoc.resolver.model.ObjectPath;
import com.schemadoc.resolver.model.PathSeparator;
import com.schemadoc.resolver.model.SearchPolicy;
import com.schemadoc.resolver.parser.MalformedIdentifierException;
import com.schemadoc.resolver.parser.ObjectPathParser;

/**
 * Validates lookup options and merges them over the configuration file, if any.
 * All problems are reported together.
 */
public class LookupOptionsValidator {

	private final ResolverConfigLoader configLoader;
	private final ObjectPathParser pathParser;

	public LookupOptionsValidator() {
		this(new ResolverConfigLoader(), new ObjectPathParser());
	}

	public LookupOptionsValidator(ResolverConfigLoader configLoader, ObjectPathParser pathParser) {
		this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
		this.pathParser = Objects.requireNonNull(pathParser, "pathParser");
	}

	/**
	 * @param requireSchemaDir whether the command probes the filesystem
	 */
	public ValidatedLookupOptions validate(String identifier, LookupCliOptions o, boolean requireSchemaDir) {
		List<OptionError> errors = new ArrayList<>();

		ObjectPath objectPath = null;
		try {
			objectPath = pathParser.parse(identifier, o.isMethod() ? ObjectKind.METHOD : ObjectKind.FUNCTION);
		} catch (MalformedIdentifierException e) {
			errors.add(new OptionError(OptionsValidationException.IDENTIFIER, e.getMessage() + "."));
		}

		ResolverConfig base = ResolverConfig.defaults();
		if (o.getConfigFile() != null) {
			try {
				base = configLoader.load(o.getConfigFile());
			} catch (ConfigurationException e) {
				errors.add(new OptionError("--config", e.getMessage()));
			}
		}

		SearchPolicy.SearchPolicyBuilder policy = base.getSearchPolicy().toBuilder();
		if (o.getIncludePackageName() != null) {
			policy.includePackageName(o.getIncludePackageName());
		}
		if (o.getIncludePathToFile() != null) {
			policy.includePathToFile(o.getIncludePathToFile());
		}
		if (o.getPathToFileSeparator() != null) {
			PathSeparator.fromToken(o.getPathToFileSeparator()).ifPresentOrElse(policy::pathToFileSeparator,
					() -> errors.add(new OptionError("--path-to-file-separator", "Unknown --path-to-file-separator '"
							+ o.getPathToFileSeparator() + "'. Use '.', '/' or 'none'.")));
		}
		if (o.getPathToClassSeparator() != null) {
			PathSeparator.fromToken(o.getPathToClassSeparator()).ifPresentOrElse(policy::pathToClassSeparator,
					() -> errors.add(new OptionError("--path-to-class-separator", "Unknown --path-to-class-separator '"
							+ o.getPathToClassSeparator() + "'. Use '.', '/' or 'none'.")));
		}
		if (o.getPatterns() != null && !o.getPatterns().isEmpty()) {
			policy.clearCustomPatterns().customPatterns(o.getPatterns());
		}

		Path schemaDir = o.getSchemaDir() != null ? o.getSchemaDir() : base.getSchemaDir();
		if (requireSchemaDir) {
			if (schemaDir == null) {
				errors.add(new OptionError("--schema-dir", "A schema directory is required (--schema-dir / -d, or json_schema_dir in --config)."));
			} else if (!Files.isDirectory(schemaDir)) {
				errors.add(new OptionError("--schema-dir",
						"Schema directory does not exist or is not a directory: " + schemaDir));
			}
		}

		LookupOptions.LookupOptionsBuilder lookup = LookupOptions.builder().variant(o.getVariant());
		if (o.getKinds() != null) {
			if (o.getKinds().isEmpty()) {
				errors.add(new OptionError("--kind", "--kind requires at least one of SCHEMA, PLAIN."));
			} else {
				lookup.fileKinds(List.copyOf(o.getKinds()));
			}
		}
		if (o.getVariant() != null && o.getVariant().isBlank()) {
			errors.add(new OptionError("--variant", "--variant must not be blank."));
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		ResolverConfig config = base.toBuilder()
				.schemaDir(schemaDir)
				.searchPolicy(policy.build())
				.debugLogging(o.getDebug() != null ? o.getDebug() : base.isDebugLogging())
				.failOnMissing(o.getFailOnMissing() != null ? o.getFailOnMissing() : base.isFailOnMissing())
				.build();

		return new ValidatedLookupOptions(objectPath, config, lookup.build());
	}
}
