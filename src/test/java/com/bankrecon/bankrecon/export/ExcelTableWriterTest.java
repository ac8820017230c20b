package com.bankrecon.bankrecon.export;

import com.bankrecon.bankrecon.merge.MergedTable;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExcelTableWriterTest {

    private final ExcelTableWriter writer = new ExcelTableWriter();

    @TempDir
    Path dir;

    @Test
    void shouldWriteHeaderAndRowsWithoutIndexColumn() throws IOException {
        MergedTable table = new MergedTable(
                List.of("Kundenummer", "RETAIL", "Category_Count"),
                List.of(Map.of("Kundenummer", "001", "RETAIL", "J", "Category_Count", "1"),
                        Map.of("Kundenummer", "002", "RETAIL", "N", "Category_Count", "0")),
                Set.of("RETAIL"));
        Path outputFile = dir.resolve("out").resolve("1234_20250706.xlsx");

        writer.write(table, outputFile, Set.of("Category_Count"));

        assertTrue(Files.exists(outputFile));
        try (InputStream in = Files.newInputStream(outputFile); Workbook workbook = new XSSFWorkbook(in)) {
            Sheet sheet = workbook.getSheetAt(0);
            assertEquals("Sheet1", sheet.getSheetName());
            assertEquals(2, sheet.getLastRowNum());
            Row header = sheet.getRow(0);
            assertEquals(3, header.getLastCellNum());
            assertEquals("Kundenummer", header.getCell(0).getStringCellValue());
            Row first = sheet.getRow(1);
            assertEquals(CellType.STRING, first.getCell(0).getCellType());
            assertEquals("001", first.getCell(0).getStringCellValue());
            assertEquals(CellType.NUMERIC, first.getCell(2).getCellType());
            assertEquals(1.0, first.getCell(2).getNumericCellValue());
        }
    }

    @Test
    void shouldLeaveBlankValuesWithoutCell() throws IOException {
        MergedTable table = new MergedTable(
                List.of("Kundenummer", "AVTALE_IDs", "Navn"),
                List.of(Map.of("Kundenummer", "001", "AVTALE_IDs", "", "Navn", "Ola")),
                Set.of());
        Path outputFile = dir.resolve("blank.xlsx");

        writer.write(table, outputFile, Set.of());

        try (InputStream in = Files.newInputStream(outputFile); Workbook workbook = new XSSFWorkbook(in)) {
            Row row = workbook.getSheetAt(0).getRow(1);
            assertEquals("001", row.getCell(0).getStringCellValue());
            assertNull(row.getCell(1));
            assertEquals("Ola", row.getCell(2).getStringCellValue());
        }
    }
}
