package elan2py;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * One file-to-file translation: path checks, strict UTF-8 read, translate, write.
 *
 * The whole output is produced in memory before the output file is opened, so a failed
 * translation never leaves a partial file behind.
 */
final class TranslationJob {
	private static final Logger LOGGER = LoggerFactory.getLogger(TranslationJob.class);

	private final Path input;
	private final Path output;
	private final boolean defaultOutput;
	private final Transpiler transpiler;

	TranslationJob(Path input, Path output, boolean defaultOutput, Transpiler transpiler) {
		this.input = input;
		this.output = output;
		this.defaultOutput = defaultOutput;
		this.transpiler = transpiler;
	}

	/**
	 * @return warnings that do not stop the translation
	 */
	List<String> validate() throws TranslationException {
		List<String> warnings = new ArrayList<>();
		if (!Files.exists(input)) {
			throw new TranslationException("Input file '" + input + "' does not exist.");
		}
		if (!Files.isRegularFile(input)) {
			throw new TranslationException("'" + input + "' is not a regular file.");
		}
		if (!input.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".elan")) {
			warnings.add("Input file '" + input + "' does not have a .elan extension.");
		}
		if (!defaultOutput && Files.exists(output)) {
			throw new TranslationException("Non-default output file '" + output + "' already exists. "
					+ "Please choose a different output file name or remove the existing file.");
		}
		Path directory = output.toAbsolutePath().getParent();
		if (directory == null || !Files.isDirectory(directory)) {
			throw new TranslationException("Output directory '" + displayDirectory() + "' does not exist.");
		}
		if (!Files.isWritable(directory)) {
			throw new TranslationException("Cannot write to output directory '" + displayDirectory() + "'. Permission denied.");
		}
		return warnings;
	}

	/**
	 * @return the translated program as written
	 */
	String run() throws TranslationException {
		String source = read();
		String python;
		try {
			python = transpiler.transpile(source);
		} catch (RuntimeException e) {
			LOGGER.error("translation of {} failed", input, e);
			throw new TranslationException("Error during translation: " + e.getMessage(), e);
		}
		try {
			Files.writeString(output, python, StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new TranslationException("Error writing output file '" + output + "': " + e.getMessage(), e);
		}
		LOGGER.debug("wrote {} characters to {}", python.length(), output);
		return python;
	}

	private String read() throws TranslationException {
		try {
			return Files.readString(input, StandardCharsets.UTF_8);
		} catch (CharacterCodingException e) {
			throw new TranslationException("Input file '" + input + "' contains invalid UTF-8 characters: " + e, e);
		} catch (IOException e) {
			throw new TranslationException("Error reading input file '" + input + "': " + e.getMessage(), e);
		}
	}

	private String displayDirectory() {
		Path parent = output.getParent();
		return parent == null ? "." : parent.toString();
	}
}
