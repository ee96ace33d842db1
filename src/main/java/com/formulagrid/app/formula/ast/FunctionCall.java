package com.formulagrid.app.formula.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public final class FunctionCall implements FormulaAst {

    private final String name;
    private final List<FormulaAst> args;

    public FunctionCall(String name, List<FormulaAst> args) {
        this.name = name;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    public String getName() {
        return name;
    }

    public List<FormulaAst> getArgs() {
        return args;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof FunctionCall)) {
            return false;
        }
        FunctionCall that = (FunctionCall) o;
        return name.equals(that.name) && args.equals(that.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, args);
    }

    @Override
    public String toString() {
        return name + args.stream().map(Object::toString).collect(Collectors.joining(",", "(", ")"));
    }
}
