package elan2py.transform;

import elan2py.ast.ProcedureSignature;
import elan2py.ast.SourceLine;
import elan2py.ast.StatementKind;
import elan2py.parse.Assignment;
import elan2py.parse.LoopHeader;
import elan2py.parse.SignatureParser;
import elan2py.parse.SignatureTable;
import elan2py.parse.StatementClassifier;
import elan2py.print.GraphicsPreamble;
import org.apache.commons.lang3.StringUtils;

import java.util.Optional;

/**
 * Second pass: classifies each line and runs exactly one handler for it. Handlers write
 * zero or more lines at the current depth and open or close blocks as needed.
 */
public final class StatementDispatcher {
	private final StatementClassifier classifier = new StatementClassifier();
	private final SignatureParser signatures = new SignatureParser();
	private final ExpressionRewriter expressions = new ExpressionRewriter();
	private final ConditionRewriter conditions = new ConditionRewriter(expressions);
	private final ProcedureEmitter procedures = new ProcedureEmitter(new TypeMapper());
	private final CallSiteRewriter calls;
	private final TranslationState state;

	public StatementDispatcher(SignatureTable table, TranslationState state) {
		this.calls = new CallSiteRewriter(table, expressions);
		this.state = state;
	}

	public TranslationState state() {
		return state;
	}

	public StatementKind dispatch(SourceLine source) {
		String line = source.stripped();
		StatementKind kind = classifier.classify(line);
		switch (kind) {
			case BLANK -> state.writer().blank();
			case COMMENT -> state.emit(line);
			case MAIN_OPEN -> openBlock("def main():");
			case MAIN_CLOSE -> closeMain(line);
			case PROCEDURE_OPEN -> openProcedure(line);
			case PROCEDURE_CLOSE -> procedures.close(state, line);
			case IF_OPEN -> openBlock("if " + conditions.rewrite(guard(line, "if ")) + ":");
			case ELSE -> elseBranch(line);
			case REPEAT_OPEN -> openRepeat(line);
			case WHILE_OPEN -> openBlock("while " + conditions.rewrite(guard(line, "while ")) + ":");
			case FOR_OPEN -> openLoop(LoopHeader.parseFor(line), "FOR LOOP", line);
			case EACH_OPEN -> openLoop(LoopHeader.parseEach(line), "EACH LOOP", line);
			case IF_CLOSE, REPEAT_CLOSE, WHILE_CLOSE, FOR_CLOSE, EACH_CLOSE -> closeBlock(line);
			case ASSIGNMENT -> assignment(line);
			case CALL -> state.emit(calls.rewrite(line.substring("call ".length()).strip()));
			case RETURN -> returnStatement(line);
			case PRINT -> print(line);
			case UNRECOGNIZED -> state.emit(line);
		}
		return kind;
	}

	private void openBlock(String header) {
		state.emit(header);
		state.blocks().open();
	}

	private void closeBlock(String line) {
		if (!state.blocks().close()) {
			state.diagnostic("BLOCK", line);
		}
	}

	private void closeMain(String line) {
		closeBlock(line);
		int depth = state.blocks().depth();
		state.writer().blank();
		state.emit("if __name__ == '__main__':");
		state.emitAt("main()", depth + 1);
		if (state.has(Feature.GRAPHICS)) {
			state.emitAt(GraphicsPreamble.EXIT_ON_CLICK, depth + 1);
		}
	}

	private void openProcedure(String line) {
		Optional<ProcedureSignature> signature = signatures.parse(line);
		if (signature.isPresent()) {
			procedures.open(signature.get(), state);
			return;
		}
		// keep the block balanced so the matching end still lines up
		state.diagnostic("PROCEDURE", line);
		state.clearOutParams();
		state.blocks().open();
	}

	private void elseBranch(String line) {
		if (!state.blocks().close()) {
			state.diagnostic("BLOCK", line);
			return;
		}
		if (line.equals("else")) {
			openBlock("else:");
		} else {
			openBlock("elif " + conditions.rewrite(guard(line, "else if ")) + ":");
		}
	}

	private void openRepeat(String line) {
		Optional<LoopHeader> header = LoopHeader.parseRepeat(line);
		if (header.isPresent() && header.get() instanceof LoopHeader.Repeat repeat) {
			openBlock("for _ in range(" + expressions.rewrite(repeat.count()) + "):");
			return;
		}
		state.diagnostic("REPEAT", line);
		state.blocks().open();
	}

	private void openLoop(Optional<LoopHeader> header, String kind, String line) {
		if (header.isEmpty()) {
			state.diagnostic(kind, line);
			state.blocks().open();
			return;
		}
		if (header.get() instanceof LoopHeader.Range range) {
			String start = expressions.rewrite(range.start());
			String end = expressions.rewrite(range.end());
			if (range.step().isEmpty()) {
				openBlock("for " + range.variable() + " in range(" + start + ", " + end + " + 1):");
				return;
			}
			String step = expressions.rewrite(range.step().get());
			String bound = step.startsWith("-") ? end + " - 1" : end + " + 1";
			openBlock("for " + range.variable() + " in range(" + start + ", " + bound + ", " + step + "):");
		} else if (header.get() instanceof LoopHeader.Iteration iteration) {
			openBlock("for " + iteration.variable() + " in " + expressions.rewrite(iteration.collection()) + ":");
		}
	}

	private void assignment(String line) {
		Optional<Assignment> assignment = Assignment.parse(line);
		if (assignment.isEmpty()) {
			state.diagnostic("ASSIGNMENT", line);
			return;
		}
		state.emit(assignment.get().target() + " = " + expressions.rewrite(assignment.get().value()));
	}

	private void returnStatement(String line) {
		String value = line.substring("return".length()).strip();
		state.emit(value.isEmpty() ? "return" : "return " + expressions.rewrite(value));
	}

	private void print(String line) {
		if (line.startsWith("println ")) {
			state.emit("print(" + expressions.rewrite(line.substring("println ".length()).strip()) + ")");
		} else {
			state.emit("print(" + expressions.rewrite(line.substring("print ".length()).strip()) + ", end='')");
		}
	}

	private static String guard(String line, String keyword) {
		return StringUtils.removeEnd(line.substring(keyword.length()).strip(), " then").strip();
	}
}
