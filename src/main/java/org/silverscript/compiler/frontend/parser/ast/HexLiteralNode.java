package org.silverscript.compiler.frontend.parser.ast;

import org.silverscript.compiler.api.SourceSpan;

/**
 * A {@code 0x...} byte literal.
 *
 * @param value The bytes.
 * @param span The source range.
 */
public record HexLiteralNode(byte[] value, SourceSpan span) implements ExpressionNode {

    public HexLiteralNode {
        value = value.clone();
    }

    @Override
    public byte[] value() {
        return value.clone();
    }
}
