package elan2py.ast;

/**
 * Statement categories a single source line can fall into.
 */
public enum StatementKind {
	BLANK,
	COMMENT,
	MAIN_OPEN,
	MAIN_CLOSE,
	PROCEDURE_OPEN,
	PROCEDURE_CLOSE,
	IF_OPEN,
	ELSE,
	IF_CLOSE,
	REPEAT_OPEN,
	REPEAT_CLOSE,
	WHILE_OPEN,
	WHILE_CLOSE,
	FOR_OPEN,
	FOR_CLOSE,
	EACH_OPEN,
	EACH_CLOSE,
	ASSIGNMENT,
	CALL,
	RETURN,
	PRINT,
	UNRECOGNIZED
}
