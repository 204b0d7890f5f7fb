package elan2py;

import elan2py.ast.SourceLine;
import elan2py.parse.SignatureIndexer;
import elan2py.parse.SignatureTable;
import elan2py.print.GraphicsPreamble;
import elan2py.transform.Feature;
import elan2py.transform.StatementDispatcher;
import elan2py.transform.TranslationState;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Public entrypoint for Elan -> Python translation.
 *
 * Pass 1 indexes every procedure signature; pass 2 rewrites line by line using that
 * index. No state is kept between calls, so one instance can translate any number of
 * programs.
 */
public final class Transpiler {
	private static final Logger LOGGER = LoggerFactory.getLogger(Transpiler.class);

	private final TranslatorConfig config;

	public Transpiler() {
		this(TranslatorConfig.defaults());
	}

	public Transpiler(TranslatorConfig config) {
		this.config = Validate.notNull(config, "config must not be null");
	}

	public String transpile(String elanSource) {
		Validate.notNull(elanSource, "elanSource must not be null");
		String source = elanSource.strip();
		List<SourceLine> lines = toLines(source);

		SignatureTable table = new SignatureIndexer().index(lines);
		Set<Feature> features = Feature.detect(source);
		TranslationState state = new TranslationState(config.indentUnit(), features);
		if (state.has(Feature.GRAPHICS)) {
			state.writer().lines(GraphicsPreamble.setup(config.turtleSpeed(), config.indentUnit()));
		}

		StatementDispatcher dispatcher = new StatementDispatcher(table, state);
		lines.forEach(dispatcher::dispatch);

		if (state.blocks().depth() != 0) {
			LOGGER.warn("{} block(s) left open at end of input", state.blocks().depth());
		}
		LOGGER.debug("translated {} line(s) into {} line(s); features {}, {} diagnostic(s)",
				lines.size(), state.writer().lines().size(), features, state.diagnostics());
		return state.writer().print();
	}

	private static List<SourceLine> toLines(String source) {
		if (source.isEmpty()) {
			return List.of();
		}
		AtomicInteger number = new AtomicInteger();
		return source.lines()
				.map(raw -> new SourceLine(number.incrementAndGet(), raw.stripTrailing()))
				.collect(Collectors.toUnmodifiableList());
	}
}
