package com.bankrecon.bankrecon.pac;

import com.bankrecon.bankrecon.ReconConstants;
import com.bankrecon.bankrecon.ReconProperties;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the PAC export from the first sheet of an Excel workbook. Every cell is read as its displayed text.
 */
@Component
public class ExcelPacLookupReader implements PacLookupReader {

    private static final Logger log = LoggerFactory.getLogger(ExcelPacLookupReader.class);
    private static final List<String> REQUIRED_COLUMNS = List.of(
            ReconConstants.PAC_COLUMN_BANK_ID,
            ReconConstants.PAC_COLUMN_ORG_NUMBER,
            ReconConstants.PAC_COLUMN_PERSON_NUMBER,
            ReconConstants.PAC_COLUMN_AGREEMENT_ID,
            ReconConstants.PAC_COLUMN_USER_TYPE
    );

    private final ReconProperties reconProperties;
    private final DataFormatter dataFormatter = new DataFormatter();

    public ExcelPacLookupReader(ReconProperties reconProperties) {
        this.reconProperties = reconProperties;
    }

    @Override
    public PacLookupTable read(Path pacFile) {
        try (InputStream in = Files.newInputStream(pacFile);
             Workbook workbook = WorkbookFactory.create(in)) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new IllegalStateException(ReconConstants.MSG_PAC_NO_SHEET.formatted(pacFile));
            }
            Sheet sheet = workbook.getSheetAt(0);
            Map<String, Integer> columnIndex = headerIndex(sheet.getRow(sheet.getFirstRowNum()));

            List<String> missing = REQUIRED_COLUMNS.stream()
                    .filter(column -> !columnIndex.containsKey(column))
                    .toList();
            if (!missing.isEmpty()) {
                throw new IllegalStateException(ReconConstants.MSG_PAC_COLUMNS_MISSING.formatted(pacFile, missing));
            }

            List<PacRecord> records = new ArrayList<>();
            for (int r = sheet.getFirstRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null) {
                    continue;
                }
                String bankId = cellText(row, columnIndex.get(ReconConstants.PAC_COLUMN_BANK_ID));
                String orgNumber = cellText(row, columnIndex.get(ReconConstants.PAC_COLUMN_ORG_NUMBER));
                if (bankId.isBlank() && orgNumber.isBlank()) {
                    continue;
                }
                records.add(PacRecord.normalized(
                        bankId,
                        orgNumber,
                        cellText(row, columnIndex.get(ReconConstants.PAC_COLUMN_PERSON_NUMBER)),
                        cellText(row, columnIndex.get(ReconConstants.PAC_COLUMN_AGREEMENT_ID)),
                        cellText(row, columnIndex.get(ReconConstants.PAC_COLUMN_USER_TYPE)),
                        reconProperties.getOrgNumberWidth()
                ));
            }
            log.info("Loaded {} PAC record(s) from {}", records.size(), pacFile);
            return new PacLookupTable(records);
        } catch (IOException | EncryptedDocumentException ex) {
            throw new IllegalStateException(ReconConstants.MSG_PAC_READ_FAILED.formatted(pacFile), ex);
        }
    }

    private Map<String, Integer> headerIndex(Row header) {
        Map<String, Integer> index = new HashMap<>();
        if (header == null) {
            return index;
        }
        for (Cell cell : header) {
            String name = dataFormatter.formatCellValue(cell).trim();
            if (!name.isEmpty()) {
                index.putIfAbsent(name, cell.getColumnIndex());
            }
        }
        return index;
    }

    private String cellText(Row row, int columnIndex) {
        Cell cell = row.getCell(columnIndex);
        return cell == null ? "" : dataFormatter.formatCellValue(cell).trim();
    }
}
