package elan2py;

import org.apache.commons.lang3.Validate;

/**
 * Translator settings.
 *
 * @param indentUnit text written once per nesting level
 * @param turtleSpeed drawing speed passed to {@code t.speed()} in the graphics preamble
 * @param defaultOutputName output file used when none is given; it may be overwritten
 */
public record TranslatorConfig(String indentUnit, int turtleSpeed, String defaultOutputName) {
	public TranslatorConfig {
		Validate.notEmpty(indentUnit, "indentUnit must not be empty");
		Validate.isTrue(indentUnit.isBlank(), "indentUnit must be whitespace");
		Validate.inclusiveBetween(0, 10, turtleSpeed, "turtleSpeed must be between 0 and 10");
		Validate.notBlank(defaultOutputName, "defaultOutputName must not be blank");
	}

	public static TranslatorConfig defaults() {
		return new TranslatorConfig("    ", 6, "output.py");
	}
}
