package com.formulagrid.app.config;

import com.formulagrid.app.models.CellEdit;
import com.formulagrid.app.models.Sheet;
import com.formulagrid.app.services.SheetService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Loads a small "Budget Calculator" sheet at startup so the API has
 * something to show. Includes a cycle (C6/C7) below the main table.
 */
@Component
public class SeedSheetLoader implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(SeedSheetLoader.class);

    public static final String SEED_SHEET_ID = "seed-sheet-1";

    private final SheetService sheetService;
    private final SheetProperties properties;

    public SeedSheetLoader(SheetService sheetService, SheetProperties properties) {
        this.sheetService = sheetService;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isSeedEnabled()) {
            log.info("Seed sheet disabled");
            return;
        }
        sheetService.storeSheet(Sheet.empty(SEED_SHEET_ID, "Budget Calculator", 20, 10));
        sheetService.applyEdits(SEED_SHEET_ID, seedEdits());
        log.info("Loaded seed sheet {}", SEED_SHEET_ID);
    }

    static List<CellEdit> seedEdits() {
        return Arrays.asList(
                CellEdit.literal("A1", "Revenue"),
                CellEdit.literal("B1", "Cost"),
                CellEdit.literal("C1", "Profit"),

                CellEdit.literal("A3", 1000),
                CellEdit.literal("B3", 300),
                CellEdit.formula("C3", "=A3-B3"),

                CellEdit.literal("A4", 2000),
                CellEdit.literal("B4", 1250),
                CellEdit.formula("C4", "=A4-B4"),

                CellEdit.formula("A5", "=SUM(A3:A4)"),
                CellEdit.formula("B5", "=SUM(B3:B4)"),
                CellEdit.formula("C5", "=SUM(C3:C4)"),

                // Margin against the fixed revenue total
                CellEdit.formula("D3", "=C3/$A$5"),

                CellEdit.formula("C6", "=C7+1"),
                CellEdit.formula("C7", "=C6+1")
        );
    }
}
