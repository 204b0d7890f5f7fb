package elan2py.parse;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Procedure name to zero-based output-parameter positions. Immutable once built;
 * procedures without output parameters are absent.
 */
public final class SignatureTable {
	public static final SignatureTable EMPTY = new SignatureTable(Map.of());

	private final Map<String, List<Integer>> outPositions;

	SignatureTable(Map<String, List<Integer>> outPositions) {
		Map<String, List<Integer>> copy = new LinkedHashMap<>();
		outPositions.forEach((name, positions) -> copy.put(name, List.copyOf(positions)));
		this.outPositions = Collections.unmodifiableMap(copy);
	}

	public Optional<List<Integer>> outPositions(String name) {
		return Optional.ofNullable(outPositions.get(name));
	}

	public boolean contains(String name) {
		return outPositions.containsKey(name);
	}

	public Set<String> names() {
		return outPositions.keySet();
	}

	public int size() {
		return outPositions.size();
	}

	@Override
	public String toString() {
		return "SignatureTable" + outPositions;
	}
}
