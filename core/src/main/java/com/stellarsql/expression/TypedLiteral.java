package com.stellarsql.expression;

import com.stellarsql.parser.SourcePosition;
import com.stellarsql.types.FieldInfo;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A PostgreSQL typed constant {@code type 'text'}, e.g.
 * {@code spoint '(10d, 20d)'}. Always inlined into the SQL text.
 */
public final class TypedLiteral implements Expression {

    private final String typeName;
    private final String text;
    private final FieldInfo info;
    private final SourcePosition position;

    public TypedLiteral(String typeName, String text, FieldInfo info, SourcePosition position) {
        this.typeName = Objects.requireNonNull(typeName, "typeName");
        this.text = Objects.requireNonNull(text, "text");
        this.info = info;
        this.position = position != null ? position : SourcePosition.UNKNOWN;
    }

    public String typeName() {
        return typeName;
    }

    public String text() {
        return text;
    }

    @Override
    public SourcePosition position() {
        return position;
    }

    @Override
    public FieldInfo info() {
        return info;
    }

    @Override
    public TypedLiteral withInfo(FieldInfo newInfo) {
        return new TypedLiteral(typeName, text, newInfo, position);
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitTypedLiteral(this, context);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof TypedLiteral)) {
            return false;
        }
        TypedLiteral that = (TypedLiteral) obj;
        return typeName.equals(that.typeName) && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(typeName, text);
    }

    @Override
    public String toString() {
        return typeName + " '" + text + "'";
    }
}
