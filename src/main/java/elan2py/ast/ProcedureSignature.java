package elan2py.ast;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Declared shape of a procedure or function.
 *
 * Parameter order is the declaration order. {@code returnType} is only present for
 * functions written with a {@code returns} clause.
 */
public record ProcedureSignature(String name, List<ParameterSpec> parameters, Optional<String> returnType) {
	public ProcedureSignature {
		parameters = List.copyOf(parameters);
	}

	public List<Integer> outPositions() {
		return IntStream.range(0, parameters.size())
				.filter(i -> parameters.get(i).isOut())
				.boxed()
				.collect(Collectors.toUnmodifiableList());
	}

	public List<String> outNames() {
		return parameters.stream()
				.filter(ParameterSpec::isOut)
				.map(ParameterSpec::name)
				.collect(Collectors.toUnmodifiableList());
	}
}
