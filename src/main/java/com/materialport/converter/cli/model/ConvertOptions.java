package com.materialport.converter.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "convert" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class ConvertOptions {

	@Option(names = { "--package", "-p" }, required = true, description = "Path to the .unitypackage file")
	private Path packageFile;

	@Option(names = { "--material-list",
			"-m" }, description = "Material list file (repeatable). Defaults to MaterialList*.txt next to the package")
	private List<Path> materialLists = new ArrayList<>();

	@Option(names = { "--output-dir", "-o" }, description = "Output directory (defaults to current directory)")
	private Path outputDir;

	@Option(names = {
			"--shader-base" }, defaultValue = "res://shaders", description = "Resource path the shader files live under (default: ${DEFAULT-VALUE})")
	private String shaderBase;

	@Option(names = {
			"--texture-base" }, defaultValue = "res://textures", description = "Resource path the texture files live under (default: ${DEFAULT-VALUE})")
	private String textureBase;

	@Option(names = {
			"--max-content-bytes" }, defaultValue = "4194304", description = "Largest non-texture asset read from the package (default: ${DEFAULT-VALUE})")
	private long maxContentBytes;

	@Option(names = { "--dry-run" }, description = "Convert and report without writing any files")
	private boolean dryRun;
}
