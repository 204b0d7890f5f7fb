package elan2py.ast;

/**
 * One line of Elan source as read, before any trimming.
 *
 * Line numbers are 1-based.
 */
public record SourceLine(int number, String raw) {
	public String stripped() {
		return raw.strip();
	}

	public boolean isBlank() {
		return raw.isBlank();
	}

	public boolean isComment() {
		return stripped().startsWith("#");
	}
}
