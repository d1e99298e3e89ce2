package org.silverscript.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur during compilation.
 * This decouples the test logic from the error messages.
 */
public enum CompilerErrorCode {
    // region Lexer & Parser Errors
    /** A character that cannot start any token. */
    UNEXPECTED_CHARACTER,
    /** A string literal without closing quote on the same line. */
    UNTERMINATED_STRING,
    /** A numeric or hex literal that cannot be represented. */
    INVALID_NUMBER,
    /** A token that does not fit the grammar at its position. */
    UNEXPECTED_TOKEN,
    // endregion

    // region Semantic Analysis Errors
    /** A type name that is not a SilverScript type. */
    UNKNOWN_TYPE,
    /** An identifier that does not name a visible variable or constructor parameter. */
    UNRESOLVED_IDENTIFIER,
    /** A call to a function that is neither declared nor built in. */
    UNKNOWN_FUNCTION,
    /** A call with the wrong number of arguments. */
    ARITY_MISMATCH,
    /** An operand, argument or initializer of the wrong type. */
    TYPE_MISMATCH,
    /** Two functions with the same name. */
    DUPLICATE_FUNCTION,
    /** A variable or parameter that redeclares a visible name. */
    DUPLICATE_VARIABLE,
    /** A contract without any entrypoint function. */
    MISSING_ENTRYPOINT,
    /** A helper function that reaches itself through calls. */
    RECURSIVE_CALL,
    /** A call statement that targets an entrypoint function. */
    ENTRYPOINT_NOT_CALLABLE,
    /** An assignment to a constructor parameter. */
    ASSIGNMENT_TO_CONSTANT,
    /** Constructor arguments that do not match the constructor parameters. */
    CONSTRUCTOR_ARGUMENT_MISMATCH
    // endregion
}
