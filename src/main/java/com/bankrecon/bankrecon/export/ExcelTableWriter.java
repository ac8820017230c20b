package com.bankrecon.bankrecon.export;

import com.bankrecon.bankrecon.ReconConstants;
import com.bankrecon.bankrecon.merge.MergedTable;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes a table to a single-sheet xlsx file: bold header row, then one row per table row, no index column.
 * Blank values get no cell.
 */
@Component
public class ExcelTableWriter {

    /**
     * Values of {@code numericColumns} are written as numbers when they parse, everything else as text.
     */
    public void write(MergedTable table, Path outputFile, Set<String> numericColumns) {
        try {
            Path parent = outputFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Workbook workbook = new XSSFWorkbook();
                 OutputStream out = Files.newOutputStream(outputFile)) {
                Sheet sheet = workbook.createSheet(ReconConstants.OUTPUT_SHEET_NAME);
                List<String> columns = table.columns();

                CellStyle headerStyle = workbook.createCellStyle();
                Font headerFont = workbook.createFont();
                headerFont.setBold(true);
                headerStyle.setFont(headerFont);

                Row header = sheet.createRow(0);
                for (int c = 0; c < columns.size(); c++) {
                    Cell cell = header.createCell(c);
                    cell.setCellValue(columns.get(c));
                    cell.setCellStyle(headerStyle);
                }

                int rowNum = 1;
                for (Map<String, String> source : table.rows()) {
                    Row row = sheet.createRow(rowNum++);
                    for (int c = 0; c < columns.size(); c++) {
                        String column = columns.get(c);
                        String value = source.getOrDefault(column, ReconConstants.BLANK);
                        if (value.isEmpty()) {
                            continue;
                        }
                        Cell cell = row.createCell(c);
                        if (numericColumns.contains(column) && isInteger(value)) {
                            cell.setCellValue(Long.parseLong(value));
                        } else {
                            cell.setCellValue(value);
                        }
                    }
                }
                workbook.write(out);
            }
        } catch (IOException ex) {
            throw new IllegalStateException(ReconConstants.MSG_OUTPUT_WRITE_FAILED.formatted(outputFile), ex);
        }
    }

    private boolean isInteger(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return value.length() < 19;
    }
}
