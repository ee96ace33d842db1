package com.formulagrid.app.models;

import java.util.Objects;

/**
 * A cell holding a plain value: a Double, String or Boolean.
 */
public final class LiteralCell implements Cell {

    private final Object value;

    public LiteralCell(Object value) {
        this.value = Scalars.normalize(value);
    }

    public Object getValue() {
        return value;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LiteralCell && Objects.equals(((LiteralCell) o).value, value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }
}
