package elan2py.transform;

import elan2py.ast.ParameterSpec;
import elan2py.ast.ProcedureSignature;

import java.util.stream.Collectors;

/**
 * Procedure and function boundaries. Output parameters become ordinary parameters and
 * are handed back by a synthesized {@code return} when the body closes.
 */
public final class ProcedureEmitter {
	private final TypeMapper types;

	public ProcedureEmitter(TypeMapper types) {
		this.types = types;
	}

	public void open(ProcedureSignature signature, TranslationState state) {
		String params = signature.parameters().stream()
				.map(this::parameter)
				.collect(Collectors.joining(", "));
		StringBuilder header = new StringBuilder("def ").append(signature.name())
				.append("(").append(params).append(")");
		if (signature.returnType().isPresent() && signature.outNames().isEmpty()) {
			String returnType = types.map(signature.returnType().get());
			if (!returnType.isEmpty()) {
				header.append(" -> ").append(returnType);
			}
		}
		state.emit(header.append(":").toString());
		state.activeOutParams(signature.outNames());
		state.blocks().open();
	}

	public void close(TranslationState state, String line) {
		if (!state.activeOutParams().isEmpty()) {
			state.emit("return " + String.join(", ", state.activeOutParams()));
			state.clearOutParams();
		}
		if (!state.blocks().close()) {
			state.diagnostic("BLOCK", line);
			return;
		}
		state.writer().blank();
	}

	private String parameter(ParameterSpec param) {
		String type = param.declaredType().map(types::map).orElse("");
		return type.isEmpty() ? param.name() : param.name() + ": " + type;
	}
}
