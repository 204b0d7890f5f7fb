package elan2py.ast;

import java.util.Optional;

public record ParameterSpec(String name, Optional<String> declaredType, Direction direction) {
	public enum Direction {
		IN, OUT
	}

	public boolean isOut() {
		return direction == Direction.OUT;
	}
}
