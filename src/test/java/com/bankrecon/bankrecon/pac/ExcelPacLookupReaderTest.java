package com.bankrecon.bankrecon.pac;

import com.bankrecon.bankrecon.ReconProperties;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExcelPacLookupReaderTest {

    private final ExcelPacLookupReader reader = new ExcelPacLookupReader(new ReconProperties());

    @TempDir
    Path dir;

    @Test
    void shouldReadNumericAndTextCellsAsNormalizedText() throws IOException {
        Path pacFile = dir.resolve("pac.xlsx");
        try (Workbook workbook = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(pacFile)) {
            Sheet sheet = workbook.createSheet("PAC");
            Row header = sheet.createRow(0);
            String[] names = {"BANK_ID", "FORETAKSNR", "PERSONNR", "AVTALE_ID", "BRUKERTYPE", "KOMMENTAR"};
            for (int i = 0; i < names.length; i++) {
                header.createCell(i).setCellValue(names[i]);
            }
            Row first = sheet.createRow(1);
            first.createCell(0).setCellValue(1234);
            first.createCell(1).setCellValue(912345678);
            first.createCell(2).setCellValue("01017012345");
            first.createCell(3).setCellValue("A-1");
            first.createCell(4).setCellValue("ADMIN");
            sheet.createRow(2);
            Row third = sheet.createRow(3);
            third.createCell(0).setCellValue("5678");
            third.createCell(1).setCellValue("00987654321");
            third.createCell(3).setCellValue("B-1");
            workbook.write(out);
        }

        PacLookupTable table = reader.read(pacFile);

        assertEquals(2, table.records().size());
        assertEquals(new PacRecord("1234", "00912345678", "01017012345", "A-1", "ADMIN"), table.records().get(0));
        assertEquals(new PacRecord("5678", "00987654321", "", "B-1", ""), table.records().get(1));
        assertTrue(table.hasBank("5678"));
    }

    @Test
    void shouldFailWhenRequiredColumnIsMissing() throws IOException {
        Path pacFile = dir.resolve("pac.xlsx");
        try (Workbook workbook = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(pacFile)) {
            Row header = workbook.createSheet("PAC").createRow(0);
            header.createCell(0).setCellValue("BANK_ID");
            header.createCell(1).setCellValue("FORETAKSNR");
            workbook.write(out);
        }

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> reader.read(pacFile));
        assertTrue(ex.getMessage().contains("PERSONNR"));
    }

    @Test
    void shouldFailWhenFileCannotBeRead() {
        assertThrows(IllegalStateException.class, () -> reader.read(dir.resolve("missing.xlsx")));
    }
}
