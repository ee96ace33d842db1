package com.formulagrid.app.services;

import com.formulagrid.app.config.SheetProperties;
import com.formulagrid.app.engine.FormulaEngine;
import com.formulagrid.app.exceptions.InvalidAddressException;
import com.formulagrid.app.exceptions.SheetNotFoundException;
import com.formulagrid.app.formula.FormulaParser;
import com.formulagrid.app.grid.AddressCodec;
import com.formulagrid.app.grid.FormulaTranslation;
import com.formulagrid.app.models.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Main business logic for creating sheets, applying cell edits,
 * and evaluating formulas.
 * <p>
 * Sheets are values: every edit batch builds a new Sheet and swaps it in.
 * Edits to one sheet are serialized by a per-sheet lock; each evaluation
 * gets its own FormulaEngine.
 */
@Service
public class SheetService {

    private static final Logger log = LoggerFactory.getLogger(SheetService.class);

    // All sheets live here in memory; no persistent DB
    private final Map<String, Sheet> sheets = new ConcurrentHashMap<>();
    private final Map<String, ReentrantReadWriteLock> locks = new ConcurrentHashMap<>();

    private final SheetProperties properties;

    public SheetService(SheetProperties properties) {
        this.properties = properties;
    }

    /**
     * Creates a new empty Sheet and returns its snapshot.
     * Missing rows/cols fall back to the configured defaults.
     */
    public SheetSnapshot createSheet(SheetCreateRequest request) {
        String name = request.getName() != null ? request.getName() : "Untitled";
        int rows = request.getRows() != null ? request.getRows() : properties.getDefaultRows();
        int cols = request.getCols() != null ? request.getCols() : properties.getDefaultCols();
        if (rows < 1 || rows > properties.getMaxRows()) {
            throw new IllegalArgumentException("rows must be between 1 and " + properties.getMaxRows());
        }
        if (cols < 1 || cols > properties.getMaxCols()) {
            throw new IllegalArgumentException("cols must be between 1 and " + properties.getMaxCols());
        }

        Sheet sheet = Sheet.empty(UUID.randomUUID().toString(), name, rows, cols);
        storeSheet(sheet);
        log.info("Created sheet {} ({}x{}) named '{}'", sheet.getId(), rows, cols, name);
        return snapshot(sheet);
    }

    /**
     * Stores a sheet, replacing any sheet with the same ID.
     */
    public void storeSheet(Sheet sheet) {
        locks.putIfAbsent(sheet.getId(), new ReentrantReadWriteLock());
        sheets.put(sheet.getId(), sheet);
    }

    /**
     * Retrieves a Sheet by ID. Throws if not found.
     */
    public Sheet getSheet(String sheetId) {
        Sheet sheet = sheets.get(sheetId);
        if (sheet == null) {
            throw new SheetNotFoundException("Sheet not found: " + sheetId);
        }
        return sheet;
    }

    /**
     * Returns the sheet with every cell evaluated.
     */
    public SheetSnapshot getSnapshot(String sheetId) {
        ReentrantReadWriteLock lock = lockFor(sheetId);
        lock.readLock().lock();
        try {
            return snapshot(getSheet(sheetId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Applies a batch of edits, then re-evaluates the whole sheet:
     * 1) Validate every address (bad address or out of bounds => nothing is applied).
     * 2) Build the new cell content; formulas that fail to parse become PARSE error cells.
     * 3) Swap in the new Sheet and return its snapshot.
     */
    public SheetSnapshot applyEdits(String sheetId, List<CellEdit> edits) {
        if (edits == null) {
            throw new IllegalArgumentException("edits are required");
        }
        ReentrantReadWriteLock lock = lockFor(sheetId);

        // Prevent lost updates among multiple writers
        lock.writeLock().lock();
        try {
            Sheet sheet = getSheet(sheetId);
            Map<CellAddress, Cell> cells = new LinkedHashMap<>(sheet.getCells());

            for (CellEdit edit : edits) {
                CellAddress address = resolveAddress(sheet, edit.getAddr());
                if (edit.getKind() == null) {
                    throw new IllegalArgumentException("Edit for " + address + " has no kind");
                }
                switch (edit.getKind()) {
                    case LITERAL:
                        if (edit.getValue() == null) {
                            throw new IllegalArgumentException("Literal edit for " + address + " needs a value");
                        }
                        cells.put(address, new LiteralCell(edit.getValue()));
                        break;
                    case FORMULA:
                        if (edit.getFormula() == null) {
                            throw new IllegalArgumentException("Formula edit for " + address + " needs a formula");
                        }
                        cells.put(address, FormulaParser.parseCell(edit.getFormula()));
                        break;
                    case CLEAR:
                        cells.remove(address);
                        break;
                }
            }

            Sheet updated = sheet.withCells(cells);
            // Evaluate before storing: a failure here leaves the previous sheet in place
            SheetSnapshot result = snapshot(updated);
            sheets.put(sheetId, updated);
            log.info("Applied {} edits to sheet {}", edits.size(), sheetId);
            return result;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Copies one cell onto another. Relative references in a formula move
     * with the paste offset; fixed ($) parts stay. A reference pushed off
     * the sheet turns the pasted cell into a REF error.
     */
    public SheetSnapshot pasteCell(String sheetId, String fromText, String toText) {
        ReentrantReadWriteLock lock = lockFor(sheetId);
        lock.writeLock().lock();
        try {
            Sheet sheet = getSheet(sheetId);
            CellAddress from = resolveAddress(sheet, fromText);
            CellAddress to = resolveAddress(sheet, toText);

            Map<CellAddress, Cell> cells = new LinkedHashMap<>(sheet.getCells());
            Cell source = sheet.getCell(from);
            if (source == null) {
                cells.remove(to);
            } else {
                cells.put(to, source.accept(new Cell.Visitor<Cell>() {
                    @Override
                    public Cell visitLiteral(LiteralCell cell) {
                        return cell;
                    }

                    @Override
                    public Cell visitFormula(FormulaCell cell) {
                        FormulaTranslation translated = AddressCodec.translate(cell.getSource(), from, to);
                        if (translated.hasOffGridReference()) {
                            return new ErrorCell(ErrorCode.REF, "Reference moved off the sheet: " + translated);
                        }
                        return FormulaParser.parseCell(translated.getFormula());
                    }

                    @Override
                    public Cell visitError(ErrorCell cell) {
                        return cell;
                    }
                }));
            }

            Sheet updated = sheet.withCells(cells);
            SheetSnapshot result = snapshot(updated);
            sheets.put(sheetId, updated);
            log.info("Pasted {} onto {} in sheet {}", from, to, sheetId);
            return result;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public CellExplanation explainCell(String sheetId, String addressText) {
        ReentrantReadWriteLock lock = lockFor(sheetId);
        lock.readLock().lock();
        try {
            Sheet sheet = getSheet(sheetId);
            return new FormulaEngine().explainCell(sheet, resolveAddress(sheet, addressText));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * For each formula cell => the cells it reads.
     */
    public Map<String, List<String>> getForwardDependencies(String sheetId) {
        return dependencyEngine(sheetId).getDependencyGraph().forwardView();
    }

    /**
     * For each referenced cell => the formula cells that read it.
     */
    public Map<String, List<String>> getReverseDependencies(String sheetId) {
        return dependencyEngine(sheetId).getDependencyGraph().reverseView();
    }

    // ----------------------------------------------------------------
    // Internal Helpers (used within this service only)
    // ----------------------------------------------------------------

    private FormulaEngine dependencyEngine(String sheetId) {
        ReentrantReadWriteLock lock = lockFor(sheetId);
        lock.readLock().lock();
        try {
            FormulaEngine engine = new FormulaEngine();
            engine.rebuildDependencies(getSheet(sheetId));
            return engine;
        } finally {
            lock.readLock().unlock();
        }
    }

    private ReentrantReadWriteLock lockFor(String sheetId) {
        ReentrantReadWriteLock lock = locks.get(sheetId);
        if (lock == null) {
            throw new SheetNotFoundException("Sheet not found: " + sheetId);
        }
        return lock;
    }

    /**
     * Parses an address from a request and checks it lies inside the sheet.
     */
    private CellAddress resolveAddress(Sheet sheet, String text) {
        if (text == null) {
            throw new IllegalArgumentException("Cell address is required");
        }
        CellAddress address = CellAddress.parse(text.trim().toUpperCase());
        if (!AddressCodec.isWithinBounds(address, sheet.getRows(), sheet.getCols())) {
            throw new InvalidAddressException("Cell " + address + " is outside the sheet ("
                    + sheet.getRows() + " rows x " + sheet.getCols() + " cols)");
        }
        return address;
    }

    /**
     * Evaluates every formula and pairs each stored cell with the value it shows.
     */
    private SheetSnapshot snapshot(Sheet sheet) {
        Map<CellAddress, EvalResult> results = new FormulaEngine().evaluateSheet(sheet);

        Map<String, Cell> cells = new LinkedHashMap<>();
        Map<String, Object> computedValues = new LinkedHashMap<>();
        for (Map.Entry<CellAddress, Cell> entry : sheet.getCells().entrySet()) {
            CellAddress address = entry.getKey();
            cells.put(address.toString(), entry.getValue());
            computedValues.put(address.toString(), entry.getValue().accept(new Cell.Visitor<Object>() {
                @Override
                public Object visitLiteral(LiteralCell cell) {
                    return cell.getValue();
                }

                @Override
                public Object visitFormula(FormulaCell cell) {
                    return results.get(address).displayValue();
                }

                @Override
                public Object visitError(ErrorCell cell) {
                    return cell.getCode().token();
                }
            }));
        }
        return new SheetSnapshot(sheet, cells, computedValues);
    }
}
