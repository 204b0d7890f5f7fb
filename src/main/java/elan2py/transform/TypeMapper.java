package elan2py.transform;

import elan2py.parse.SourceText;

import java.util.List;
import java.util.Map;

/**
 * Elan type names to Python annotations. Unknown names pass through unchanged.
 */
public final class TypeMapper {
	private static final Map<String, String> SIMPLE = Map.of(
			"Int", "int",
			"Float", "float",
			"Bool", "bool",
			"Boolean", "bool",
			"String", "str",
			"Str", "str");

	private static final List<String> SEQUENCES = List.of("Array<of ", "List<of ");
	private static final String DICTIONARY = "Dictionary<of ";

	public String map(String elanType) {
		if (elanType == null || elanType.isBlank()) {
			return "";
		}
		String type = elanType.strip();
		String simple = SIMPLE.get(type);
		if (simple != null) {
			return simple;
		}
		if (!type.endsWith(">")) {
			return type;
		}
		for (String prefix : SEQUENCES) {
			if (type.startsWith(prefix)) {
				return "list[" + map(type.substring(prefix.length(), type.length() - 1)) + "]";
			}
		}
		if (type.startsWith(DICTIONARY)) {
			List<String> parts = SourceText.splitParameters(type.substring(DICTIONARY.length(), type.length() - 1));
			if (parts.size() == 2) {
				return "dict[" + map(parts.get(0)) + ", " + map(parts.get(1)) + "]";
			}
		}
		return type;
	}
}
