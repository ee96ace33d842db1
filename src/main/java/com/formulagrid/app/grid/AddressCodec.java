package com.formulagrid.app.grid;

import com.formulagrid.app.exceptions.InvalidAddressException;
import com.formulagrid.app.models.CellAddress;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conversions between textual cell addresses ("A1", "$B$2") and
 * 0-based column/row indices, plus range expansion and the reference
 * rewriting used by copy/paste and row/column insertion.
 */
public final class AddressCodec {

    // "$A$1", "A$1", "$A1", "A1"
    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^(\\$?)([A-Z]+)(\\$?)(\\d+)$");

    // A string literal (group 1, kept verbatim) or an address token in any letter case
    private static final Pattern ADDRESS_TOKEN_PATTERN =
            Pattern.compile("(\"[^\"]*\"?)|(\\$?)([A-Za-z]+)(\\$?)(\\d+)");

    public static final String REF_ERROR_TOKEN = "#REF!";

    private AddressCodec() {
    }

    /**
     * Decodes an address. Letters are a bijective base-26 numeral (A=1 .. Z=26, AA=27),
     * digits a 1-based row; both come back 0-based.
     */
    public static ParsedAddress parseAddress(String text) {
        if (text == null) {
            throw new InvalidAddressException("Invalid cell address: null");
        }
        Matcher matcher = ADDRESS_PATTERN.matcher(text);
        if (!matcher.matches()) {
            throw new InvalidAddressException("Invalid cell address: " + text);
        }

        int col = lettersToColumn(matcher.group(2));
        int row;
        try {
            row = Integer.parseInt(matcher.group(4)) - 1;
        } catch (NumberFormatException e) {
            throw new InvalidAddressException("Row out of range in address: " + text);
        }
        if (row < 0) {
            throw new InvalidAddressException("Row numbers start at 1: " + text);
        }

        return new ParsedAddress(col, row, "$".equals(matcher.group(1)), "$".equals(matcher.group(3)));
    }

    public static String formatAddress(int col, int row) {
        return formatAddress(col, row, false, false);
    }

    public static String formatAddress(int col, int row, boolean fixedCol, boolean fixedRow) {
        if (col < 0 || row < 0) {
            throw new InvalidAddressException("Cannot format negative indices: col=" + col + ", row=" + row);
        }
        return (fixedCol ? "$" : "") + columnToLetters(col) + (fixedRow ? "$" : "") + (row + 1);
    }

    /**
     * 0 -> A, 25 -> Z, 26 -> AA.
     */
    public static String columnToLetters(int col) {
        StringBuilder letters = new StringBuilder();
        int remaining = col;
        while (remaining >= 0) {
            letters.append((char) ('A' + remaining % 26));
            remaining = remaining / 26 - 1;
        }
        return letters.reverse().toString();
    }

    /**
     * A -> 0, Z -> 25, AA -> 26.
     */
    public static int lettersToColumn(String letters) {
        int col = 0;
        try {
            for (int i = 0; i < letters.length(); i++) {
                col = Math.addExact(Math.multiplyExact(col, 26), letters.charAt(i) - 'A' + 1);
            }
        } catch (ArithmeticException e) {
            throw new InvalidAddressException("Column out of range: " + letters);
        }
        return col - 1;
    }

    /**
     * All addresses in the inclusive rectangle spanned by two corners, row by row.
     * The corners may be given in any order.
     */
    public static List<CellAddress> expandRange(CellAddress start, CellAddress end) {
        int minCol = Math.min(start.getCol(), end.getCol());
        int maxCol = Math.max(start.getCol(), end.getCol());
        int minRow = Math.min(start.getRow(), end.getRow());
        int maxRow = Math.max(start.getRow(), end.getRow());

        long size = ((long) maxCol - minCol + 1) * ((long) maxRow - minRow + 1);
        if (size > Integer.MAX_VALUE - 8) {
            throw new InvalidAddressException("Range too large: " + start + ":" + end);
        }
        List<CellAddress> cells = new ArrayList<>((int) size);
        for (int row = minRow; row <= maxRow; row++) {
            for (int col = minCol; col <= maxCol; col++) {
                cells.add(new CellAddress(col, row));
            }
        }
        return cells;
    }

    /**
     * Shifts a reference for a row/column insertion or deletion.
     * Insertions move indices at or after the insertion point; deletions move
     * indices after the deleted one. Fixed axes never move.
     *
     * @param insertedAt insertion point, or null
     * @param deletedAt deletion point, or null
     */
    public static ParsedAddress adjustReference(CellAddress address, GridShift insertedAt, GridShift deletedAt,
                                                boolean fixedCol, boolean fixedRow) {
        int col = address.getCol();
        int row = address.getRow();

        if (insertedAt != null) {
            if (insertedAt.getCol() != null && !fixedCol && col >= insertedAt.getCol()) {
                col++;
            }
            if (insertedAt.getRow() != null && !fixedRow && row >= insertedAt.getRow()) {
                row++;
            }
        }
        if (deletedAt != null) {
            if (deletedAt.getCol() != null && !fixedCol && col > deletedAt.getCol()) {
                col--;
            }
            if (deletedAt.getRow() != null && !fixedRow && row > deletedAt.getRow()) {
                row--;
            }
        }

        return new ParsedAddress(col, row, fixedCol, fixedRow);
    }

    /**
     * Rewrites the relative parts of every address in a formula by the offset
     * between two cells. References pushed off the grid become #REF!.
     * Only intended for formula text that already parsed successfully.
     */
    public static String translateFormula(String formula, CellAddress from, CellAddress to) {
        return translate(formula, from, to).getFormula();
    }

    /**
     * Same as {@link #translateFormula}, also reporting whether a reference left the grid.
     * Text inside string literals is never rewritten.
     */
    public static FormulaTranslation translate(String formula, CellAddress from, CellAddress to) {
        int colOffset = to.getCol() - from.getCol();
        int rowOffset = to.getRow() - from.getRow();
        boolean offGrid = false;

        Matcher matcher = ADDRESS_TOKEN_PATTERN.matcher(formula);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            if (matcher.group(1) != null) {
                matcher.appendReplacement(out, Matcher.quoteReplacement(matcher.group()));
                continue;
            }
            boolean fixedCol = "$".equals(matcher.group(2));
            boolean fixedRow = "$".equals(matcher.group(4));
            int col = lettersToColumn(matcher.group(3).toUpperCase());
            int row = Integer.parseInt(matcher.group(5)) - 1;
            if (!fixedCol) {
                col += colOffset;
            }
            if (!fixedRow) {
                row += rowOffset;
            }
            String replacement;
            if (col < 0 || row < 0) {
                offGrid = true;
                replacement = REF_ERROR_TOKEN;
            } else {
                replacement = formatAddress(col, row, fixedCol, fixedRow);
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return new FormulaTranslation(out.toString(), offGrid);
    }

    public static boolean isWithinBounds(CellAddress address, int rows, int cols) {
        return address.getCol() < cols && address.getRow() < rows;
    }

    /**
     * The adjacent cell in the given direction, or empty at the sheet edge.
     */
    public static Optional<CellAddress> neighbor(CellAddress address, Direction direction, int rows, int cols) {
        int col = address.getCol();
        int row = address.getRow();
        switch (direction) {
            case UP:
                row--;
                break;
            case DOWN:
                row++;
                break;
            case LEFT:
                col--;
                break;
            case RIGHT:
                col++;
                break;
        }
        if (col < 0 || row < 0 || col >= cols || row >= rows) {
            return Optional.empty();
        }
        return Optional.of(new CellAddress(col, row));
    }
}
