package com.formulagrid.app.models;

/**
 * One entry of an edit batch, e.g.
 * { "addr": "B2", "kind": "formula", "formula": "=SUM(A1:A3)" }.
 * "value" is used by literal edits, "formula" by formula edits.
 */
public class CellEdit {
    private String addr;
    private EditKind kind;
    private Object value;
    private String formula;

    // Default constructor needed for JSON (de)serialization
    public CellEdit() {
    }

    public CellEdit(String addr, EditKind kind, Object value, String formula) {
        this.addr = addr;
        this.kind = kind;
        this.value = value;
        this.formula = formula;
    }

    public static CellEdit literal(String addr, Object value) {
        return new CellEdit(addr, EditKind.LITERAL, value, null);
    }

    public static CellEdit formula(String addr, String formula) {
        return new CellEdit(addr, EditKind.FORMULA, null, formula);
    }

    public static CellEdit clear(String addr) {
        return new CellEdit(addr, EditKind.CLEAR, null, null);
    }

    public String getAddr() {
        return addr;
    }

    public void setAddr(String addr) {
        this.addr = addr;
    }

    public EditKind getKind() {
        return kind;
    }

    public void setKind(EditKind kind) {
        this.kind = kind;
    }

    public Object getValue() {
        return value;
    }

    public void setValue(Object value) {
        this.value = value;
    }

    public String getFormula() {
        return formula;
    }

    public void setFormula(String formula) {
        this.formula = formula;
    }
}
