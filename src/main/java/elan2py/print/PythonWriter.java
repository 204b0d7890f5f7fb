package elan2py.print;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accumulates Python output lines. Blank lines are written without indentation.
 */
public final class PythonWriter {
	private final String indentUnit;
	private final List<String> lines = new ArrayList<>();

	public PythonWriter(String indentUnit) {
		this.indentUnit = indentUnit;
	}

	public void line(String text, int depth) {
		if (text.isBlank()) {
			lines.add("");
			return;
		}
		lines.add(indentUnit.repeat(Math.max(0, depth)) + text);
	}

	public void blank() {
		lines.add("");
	}

	public void lines(List<String> block) {
		lines.addAll(block);
	}

	public List<String> lines() {
		return Collections.unmodifiableList(lines);
	}

	public String print() {
		return String.join("\n", lines);
	}
}
