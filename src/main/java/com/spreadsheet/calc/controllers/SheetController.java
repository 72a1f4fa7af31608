package com.spreadsheet.calc.controllers;

import com.spreadsheet.calc.models.CellView;
import com.spreadsheet.calc.services.SheetService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * REST endpoints the grid front end uses to drive a sheet.
 * "/sheet" is the base path.
 */
@RestController
@RequestMapping("/sheet")
public class SheetController {

    @Autowired
    private SheetService sheetService;

    /**
     * POST /sheet
     * Creates a new empty Sheet, returns the sheetId.
     */
    @PostMapping
    public ResponseEntity<Long> createSheet() {
        long sheetId = sheetService.createSheet();
        return ResponseEntity.ok(sheetId);
    }

    @DeleteMapping("/{sheetId}")
    public ResponseEntity<Void> deleteSheet(@PathVariable long sheetId) {
        sheetService.deleteSheet(sheetId);
        return ResponseEntity.noContent().build();
    }

    /**
     * PUT /sheet/{sheetId}/cell/{address}
     * Body: raw cell text (a literal, or a formula starting with "=").
     * On success: 200 OK.
     * A syntax error, a circular reference or a bad address is thrown as an exception
     * which the GlobalExceptionHandler turns into a 400.
     */
    @PutMapping("/{sheetId}/cell/{address}")
    public ResponseEntity<Void> setCellValue(
            @PathVariable long sheetId,
            @PathVariable String address,
            @RequestBody(required = false) String rawValue
    ) {
        sheetService.setCellValue(sheetId, address, rawValue);
        return ResponseEntity.ok().build();
    }

    @DeleteMapping("/{sheetId}/cell/{address}")
    public ResponseEntity<Void> clearCell(@PathVariable long sheetId, @PathVariable String address) {
        sheetService.clearCell(sheetId, address);
        return ResponseEntity.ok().build();
    }

    /**
     * GET /sheet/{sheetId}/cell/{address}
     * Returns content, display value, state and error details of one cell.
     */
    @GetMapping("/{sheetId}/cell/{address}")
    public ResponseEntity<CellView> getCell(@PathVariable long sheetId, @PathVariable String address) {
        return ResponseEntity.ok(sheetService.getCellView(sheetId, address));
    }

    /**
     * GET /sheet/{sheetId}
     * Returns display values of all populated cells,
     * in the format: { "A1": "hello", "B2": "42", ... }.
     */
    @GetMapping("/{sheetId}")
    public ResponseEntity<Map<String, String>> getSheet(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getSheetData(sheetId));
    }

    /**
     * GET /sheet/{sheetId}/export
     * Returns the sheet as rows of display values, ready for CSV serialization by the caller.
     */
    @GetMapping("/{sheetId}/export")
    public ResponseEntity<List<List<String>>> exportSheet(@PathVariable long sheetId) {
        try (Stream<List<String>> rows = sheetService.exportRows(sheetId)) {
            return ResponseEntity.ok(rows.collect(Collectors.toList()));
        }
    }

    /**
     * GET /sheet/{sheetId}/forwardDependencies
     * For each cell, the set of cells its formula reads.
     */
    @GetMapping("/{sheetId}/forwardDependencies")
    public ResponseEntity<Map<String, Set<String>>> getForwardDependencyGraph(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getForwardDependencies(sheetId));
    }

    /**
     * GET /sheet/{sheetId}/reverseDependencies
     * For each cell, the set of cells whose formulas read it.
     */
    @GetMapping("/{sheetId}/reverseDependencies")
    public ResponseEntity<Map<String, Set<String>>> getReverseDependencyGraph(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getReverseDependencies(sheetId));
    }
}
