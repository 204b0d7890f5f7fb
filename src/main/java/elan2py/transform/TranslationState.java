package elan2py.transform;

import elan2py.print.PythonWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Mutable state of one translation: nesting depth, the output parameters of the
 * procedure being emitted, detected features and the output so far. Created fresh per
 * translation and owned by its {@link StatementDispatcher}.
 */
public final class TranslationState {
	private static final Logger LOGGER = LoggerFactory.getLogger(TranslationState.class);

	private final BlockTracker blocks = new BlockTracker();
	private final Set<Feature> features;
	private final PythonWriter writer;
	private List<String> activeOutParams = List.of();
	private int diagnostics;

	public TranslationState(String indentUnit, Set<Feature> features) {
		this.writer = new PythonWriter(indentUnit);
		this.features = features.isEmpty() ? EnumSet.noneOf(Feature.class) : EnumSet.copyOf(features);
	}

	public BlockTracker blocks() {
		return blocks;
	}

	public PythonWriter writer() {
		return writer;
	}

	public boolean has(Feature feature) {
		return features.contains(feature);
	}

	public List<String> activeOutParams() {
		return activeOutParams;
	}

	public void activeOutParams(List<String> names) {
		this.activeOutParams = List.copyOf(names);
	}

	public void clearOutParams() {
		this.activeOutParams = List.of();
	}

	/** Writes at the current depth. */
	public void emit(String text) {
		writer.line(text, blocks.depth());
	}

	public void emitAt(String text, int depth) {
		writer.line(text, depth);
	}

	/**
	 * Writes {@code # <kind> ERROR: <line>} in place of a statement that could not be
	 * translated.
	 */
	public void diagnostic(String kind, String line) {
		diagnostics++;
		LOGGER.warn("could not translate {} statement: {}", kind.toLowerCase(Locale.ROOT), line);
		emit("# " + kind + " ERROR: " + line);
	}

	public int diagnostics() {
		return diagnostics;
	}
}
