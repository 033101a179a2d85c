package com.materialport.converter.cli.validation;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.materialport.converter.cli.exception.OptionsValidationException;
import com.materialport.converter.cli.model.ConvertOptions;
import com.materialport.converter.cli.model.ValidatedConvertOptions;

public class ConvertOptionsValidator {

	static final String MATERIAL_LIST_GLOB = "MaterialList*.txt";

	public ValidatedConvertOptions validate(ConvertOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getPackageFile() == null) {
			errors.add("Package file is required (--package / -p).");
		} else if (!Files.isRegularFile(o.getPackageFile())) {
			errors.add("Package file does not exist or is not a file: " + o.getPackageFile());
		}

		for (Path list : o.getMaterialLists()) {
			if (!Files.isRegularFile(list)) {
				errors.add("Material list does not exist or is not a file: " + list);
			}
		}

		if (isBlank(o.getShaderBase())) {
			errors.add("Shader base path must not be blank (--shader-base).");
		}
		if (isBlank(o.getTextureBase())) {
			errors.add("Texture base path must not be blank (--texture-base).");
		}
		if (o.getMaxContentBytes() <= 0) {
			errors.add("Max content bytes must be > 0. Got: " + o.getMaxContentBytes());
		}

		Path normalizedOutputDir = (o.getOutputDir() == null ? Path.of(".") : o.getOutputDir()).toAbsolutePath()
				.normalize();
		if (Files.exists(normalizedOutputDir) && !Files.isDirectory(normalizedOutputDir)) {
			errors.add("Output path exists and is not a directory: " + normalizedOutputDir);
		}

		boolean discovered = o.getMaterialLists().isEmpty();
		List<Path> materialLists = discovered ? discoverMaterialLists(o.getPackageFile(), errors)
				: List.copyOf(o.getMaterialLists());

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedConvertOptions(normalizedOutputDir, materialLists, discovered);
	}

	/**
	 * Material lists shipped beside the package, sorted by name.
	 */
	static List<Path> discoverMaterialLists(Path packageFile, List<String> errors) {
		if (packageFile == null || !Files.isRegularFile(packageFile)) {
			return List.of();
		}
		Path dir = packageFile.toAbsolutePath().getParent();
		if (dir == null) {
			return List.of();
		}

		List<Path> found = new ArrayList<>();
		try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, MATERIAL_LIST_GLOB)) {
			stream.forEach(found::add);
		} catch (IOException e) {
			errors.add("Cannot search " + dir + " for material lists: " + e.getMessage());
		}
		found.sort(null);
		return found;
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
