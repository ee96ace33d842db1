package com.formulagrid.app.formula;

import com.formulagrid.app.exceptions.FormulaParseException;
import com.formulagrid.app.formula.ast.FormulaAst;
import com.formulagrid.app.models.Cell;
import com.formulagrid.app.models.ErrorCell;
import com.formulagrid.app.models.ErrorCode;
import com.formulagrid.app.models.FormulaCell;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry points for turning formula text into a tree or a cell.
 */
public final class FormulaParser {

    private static final Logger log = LoggerFactory.getLogger(FormulaParser.class);

    private FormulaParser() {
    }

    /**
     * Parses formula text ("=A1+1" or "A1+1").
     *
     * @throws FormulaParseException if the text is not a valid formula
     */
    public static FormulaAst parse(String formula) {
        if (formula == null) {
            throw new IllegalArgumentException("formula cannot be null");
        }
        return new Parser(formula).parse();
    }

    /**
     * Builds the cell for a formula edit. Text that fails to parse becomes
     * a PARSE error cell; the parse failure itself never propagates.
     */
    public static Cell parseCell(String source) {
        try {
            return new FormulaCell(source, parse(source));
        } catch (FormulaParseException e) {
            log.debug("Formula {} rejected at {}: {}", source, e.getToken(), e.getMessage());
            return new ErrorCell(ErrorCode.PARSE, "Invalid formula: " + source);
        }
    }
}
