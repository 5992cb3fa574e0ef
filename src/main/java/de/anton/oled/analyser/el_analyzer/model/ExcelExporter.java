package de.anton.oled.analyser.el_analyzer.model;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Utility class to export the efficiency tables and the angular profile of a sample to an
 * Excel file (.xlsx), one sheet per table.
 */
public class ExcelExporter {

    private static final Logger logger = LoggerFactory.getLogger(ExcelExporter.class);

    public static final String SHEET_NONLAM = "NONLAM";
    public static final String SHEET_LAM = "LAM";
    public static final String SHEET_ANGULAR = "Angular";

    private static final List<String> COLUMN_NAMES_LAM = List.of(
        "V (V)", "I (mA)", "J (mA/cm2)", "Abs(J) (mA/cm2)", "L (cd/m2)", "EQE (%)", "LE (lm/W)", "CE (cd/A)", "PoD (mW/mm2)");
    private static final List<String> COLUMN_NAMES_NONLAM = List.of(
        "V (V)", "I (mA)", "J (mA/cm2)", "Abs(J) (mA/cm2)", "L (cd/m2)", "AvLum (cd/m2)", "EQE (%)", "LE (lm/W)", "CE (cd/A)", "PoD (mW/mm2)");
    private static final List<String> COLUMN_NAMES_ANGULAR = List.of(
        "Angle (deg)", "Lambertian (a.u.)", "Actual (a.u.)", "Actual_v (a.u.)");
    private static final int COLUMN_WIDTH = 18 * 256; // autoSizeColumn needs fonts, not available headless

    /**
     * Writes the workbook for one sample result. Invalid efficiency records are left out.
     */
    public Path export(SampleResult result, Path file) throws IOException {
        Objects.requireNonNull(result, "Result cannot be null.");
        Objects.requireNonNull(file, "Output file cannot be null.");
        logger.info("Starting Excel export of {} to: {}", result.run(), file);

        try (Workbook workbook = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(file)) {
            Font headerFont = workbook.createFont();
            headerFont.setBold(true);
            CellStyle headerStyle = workbook.createCellStyle();
            headerStyle.setFont(headerFont);

            writeEfficiencySheet(workbook.createSheet(SHEET_NONLAM), headerStyle, result.actual(), COLUMN_NAMES_NONLAM);
            writeEfficiencySheet(workbook.createSheet(SHEET_LAM), headerStyle, result.lambertian(), COLUMN_NAMES_LAM);

            Sheet angular = workbook.createSheet(SHEET_ANGULAR);
            createHeaderRow(angular, headerStyle, COLUMN_NAMES_ANGULAR);
            int rowNum = 1;
            for (AngularProfile.Row profileRow : result.angularProfile().rows()) {
                Row row = angular.createRow(rowNum++);
                createNumericCell(row, 0, profileRow.angle());
                createNumericCell(row, 1, profileRow.lambertian());
                createNumericCell(row, 2, profileRow.actualRadiant());
                createNumericCell(row, 3, profileRow.actualLuminous());
            }

            logger.debug("Writing workbook to file...");
            workbook.write(out);
            logger.info("Excel export completed successfully to: {}", file);
        } catch (IOException e) {
            logger.error("IOException during Excel export to {}", file, e);
            throw e;
        } catch (RuntimeException e) {
            logger.error("Unexpected error during Excel export to {}", file, e);
            throw new IOException("Unexpected error during Excel export: " + e.getMessage(), e);
        }
        return file;
    }

    private void writeEfficiencySheet(Sheet sheet, CellStyle headerStyle, EfficiencySeries series, List<String> columnNames) {
        createHeaderRow(sheet, headerStyle, columnNames);
        boolean actual = series.getModel() == EmissionModel.ACTUAL;
        int rowNum = 1;
        for (EfficiencyRecord record : series.validRecords()) {
            Row row = sheet.createRow(rowNum++);
            int cellNum = 0;
            createNumericCell(row, cellNum++, record.getVoltage());
            createNumericCell(row, cellNum++, record.getCurrentMilliAmps());
            createNumericCell(row, cellNum++, record.getCurrentDensity());
            createNumericCell(row, cellNum++, record.getAbsCurrentDensity());
            createNumericCell(row, cellNum++, record.getLuminance());
            if (actual) createNumericCell(row, cellNum++, record.getAverageLuminance());
            createNumericCell(row, cellNum++, record.getEqe());
            createNumericCell(row, cellNum++, record.getLuminousEfficacy());
            createNumericCell(row, cellNum++, record.getCurrentEfficiency());
            createNumericCell(row, cellNum, record.getPowerDensity());
        }
    }

    private void createHeaderRow(Sheet sheet, CellStyle headerStyle, List<String> columnNames) {
        Row headerRow = sheet.createRow(0);
        for (int i = 0; i < columnNames.size(); i++) {
            Cell cell = headerRow.createCell(i);
            cell.setCellValue(columnNames.get(i));
            cell.setCellStyle(headerStyle);
            sheet.setColumnWidth(i, COLUMN_WIDTH);
        }
    }

    private void createNumericCell(Row row, int colIndex, double value) {
        if (!Double.isNaN(value) && !Double.isInfinite(value)) {
            row.createCell(colIndex).setCellValue(value);
        } else {
            row.createCell(colIndex, CellType.BLANK);
        }
    }
}
