package elan2py.parse;

import elan2py.ast.ProcedureSignature;
import elan2py.ast.SourceLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * First pass: collects output-parameter positions for every declared procedure and
 * function so that call sites can be rewritten regardless of declaration order.
 */
public final class SignatureIndexer {
	private static final Logger LOGGER = LoggerFactory.getLogger(SignatureIndexer.class);

	private final SignatureParser parser = new SignatureParser();

	public SignatureTable index(List<SourceLine> lines) {
		Map<String, List<Integer>> table = new LinkedHashMap<>();
		Set<String> seen = new HashSet<>();
		for (SourceLine line : lines) {
			String text = line.stripped();
			if (!SignatureParser.isHeader(text)) {
				continue;
			}
			Optional<ProcedureSignature> signature = parser.parse(text);
			if (signature.isEmpty()) {
				continue;
			}
			String name = signature.get().name();
			if (!seen.add(name)) {
				// later declaration replaces the earlier one, including its absence of outs
				LOGGER.warn("line {}: '{}' is declared more than once; the later declaration wins",
						line.number(), name);
				table.remove(name);
			}
			List<Integer> positions = signature.get().outPositions();
			if (!positions.isEmpty()) {
				table.put(name, positions);
			}
		}
		LOGGER.debug("indexed {} procedure(s) with output parameters: {}", table.size(), table.keySet());
		return new SignatureTable(table);
	}
}
