package com.schemadoc.resolver.cli.model;

import java.nio.file.Path;
import java.util.List;

import com.schemadoc.resolver.model.FileKind;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Options shared by the commands that look up a single object. No validation, no
 * execution logic, no printing. Unset options are null so that they do not override
 * values from the configuration file.
 */
@Getter
public class LookupCliOptions {

	@Option(names = { "--config", "-c" }, description = "YAML configuration file (json_schema_dir, search_policy, ...)")
	private Path configFile;

	@Option(names = { "--schema-dir", "-d" }, description = "Directory containing schema files")
	private Path schemaDir;

	@Option(names = { "--method", "-m" }, description = "The identifier names a method: the token before the member is the class")
	private boolean method;

	@Option(names = { "--variant" }, description = "Requested variant, e.g. 'options' for Class.method.options.schema.json")
	private String variant;

	@Option(names = { "--kind" }, split = ",", description = "File kinds to try, in order: SCHEMA, PLAIN (default: both)")
	private List<FileKind> kinds;

	@Option(names = { "--include-package-name" }, negatable = true,
			description = "Try the fully-qualified name before the member-only name")
	private Boolean includePackageName;

	@Option(names = { "--path-to-file" }, negatable = true,
			description = "Try names prefixed with enclosing path segments (default: true)")
	private Boolean includePathToFile;

	@Option(names = { "--path-to-file-separator" }, description = "Separator for path segments: '.', '/' or 'none'")
	private String pathToFileSeparator;

	@Option(names = { "--path-to-class-separator" }, description = "Separator between class and member: '.', '/' or 'none'")
	private String pathToClassSeparator;

	@Option(names = { "--pattern", "-p" }, description = "Custom pattern tried first; replaces configured patterns (repeatable)")
	private List<String> patterns;

	@Option(names = { "--debug" }, description = "Log every candidate probed")
	private Boolean debug;

	@Option(names = { "--fail-on-missing" }, description = "Exit with status 2 when no schema file is found")
	private Boolean failOnMissing;
}
