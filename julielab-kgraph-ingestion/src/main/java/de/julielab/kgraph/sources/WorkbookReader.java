package de.julielab.kgraph.sources;

import de.julielab.kgraph.datarepresentation.AnnotationMapping;
import de.julielab.kgraph.datarepresentation.PropertyValue;
import org.apache.commons.lang3.StringUtils;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Reads the sheets of a workbook with Apache POI. Only {@link AnnotationSourceLoader} creates instances, and only
 * when annotation support is enabled.
 */
class WorkbookReader {
	public static final String KEY_COLUMN_NAME = "name";
	public static final String KEY_COLUMN_ID = "id";

	private final static Logger log = LoggerFactory.getLogger(WorkbookReader.class);

	private final Predicate<String> isEntityName;
	private final DataFormatter formatter = new DataFormatter(Locale.ROOT);

	WorkbookReader(Predicate<String> isEntityName) {
		this.isEntityName = isEntityName == null ? n -> false : isEntityName;
	}

	AnnotationMapping read(Path file, String sourceName) throws SourceParseException {
		AnnotationMapping mapping = new AnnotationMapping(sourceName);
		try (Workbook workbook = WorkbookFactory.create(file.toFile(), null, true)) {
			for (Sheet sheet : workbook)
				readSheet(sheet, mapping);
		} catch (IOException | RuntimeException e) {
			// POI signals malformed content with various unchecked exceptions, e.g. RecordFormatException
			throw new SourceParseException("Could not read the workbook " + file + ": " + e.getMessage(), e);
		}
		log.debug("Read annotations for {} keys from {}, key columns {}, sheets without key column {}", mapping.size(),
				sourceName, mapping.getKeyColumns(), mapping.getUnkeyedSheets());
		return mapping;
	}

	private void readSheet(Sheet sheet, AnnotationMapping mapping) {
		Row headerRow = sheet.getRow(sheet.getFirstRowNum());
		if (sheet.getPhysicalNumberOfRows() == 0 || headerRow == null) {
			log.debug("Sheet {} of {} is empty", sheet.getSheetName(), mapping.getSourceName());
			return;
		}
		List<String> headers = new ArrayList<>();
		for (int i = 0; i < headerRow.getLastCellNum(); i++)
			headers.add(StringUtils.trimToNull(formatter.formatCellValue(headerRow.getCell(i))));

		int keyColumn = findKeyColumn(sheet, headers);
		if (keyColumn < 0) {
			log.warn("Sheet {} of {} has no column identifying entities and is ignored.", sheet.getSheetName(),
					mapping.getSourceName());
			mapping.addUnkeyedSheet(sheet.getSheetName());
			return;
		}
		mapping.addKeyedSheet(sheet.getSheetName(), headers.get(keyColumn));
		for (int r = headerRow.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
			Row row = sheet.getRow(r);
			if (row == null)
				continue;
			String key = StringUtils.trimToNull(formatter.formatCellValue(row.getCell(keyColumn)));
			if (key == null)
				continue;
			for (int c = 0; c < headers.size(); c++) {
				if (c == keyColumn || headers.get(c) == null)
					continue;
				PropertyValue value = toPropertyValue(row.getCell(c), mapping.getSourceName());
				if (value != null)
					mapping.put(key, headers.get(c), value);
			}
		}
	}

	/**
	 * A column named <tt>name</tt> is preferred over one named <tt>id</tt>. Without such a column, the first column
	 * containing the display name of an existing entity is used.
	 *
	 * @return The key column index or -1 if there is none.
	 */
	private int findKeyColumn(Sheet sheet, List<String> headers) {
		int idColumn = -1;
		for (int i = 0; i < headers.size(); i++) {
			String header = headers.get(i);
			if (header == null)
				continue;
			if (header.equalsIgnoreCase(KEY_COLUMN_NAME))
				return i;
			if (idColumn < 0 && header.equalsIgnoreCase(KEY_COLUMN_ID))
				idColumn = i;
		}
		if (idColumn >= 0)
			return idColumn;
		for (int i = 0; i < headers.size(); i++) {
			if (headers.get(i) == null)
				continue;
			for (int r = sheet.getFirstRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
				Row row = sheet.getRow(r);
				if (row == null)
					continue;
				String value = StringUtils.trimToNull(formatter.formatCellValue(row.getCell(i)));
				if (value != null && isEntityName.test(value)) {
					log.debug("Column {} of sheet {} contains the entity name {} and is used as key column",
							headers.get(i), sheet.getSheetName(), value);
					return i;
				}
			}
		}
		return -1;
	}

	private PropertyValue toPropertyValue(Cell cell, String source) {
		if (cell == null)
			return null;
		CellType type = cell.getCellType();
		if (type == CellType.FORMULA)
			type = cell.getCachedFormulaResultType();
		switch (type) {
			case NUMERIC:
				if (DateUtil.isCellDateFormatted(cell))
					return PropertyValue.ofString(formatter.formatCellValue(cell), source);
				double number = cell.getNumericCellValue();
				if (number == Math.rint(number) && !Double.isInfinite(number) && Math.abs(number) < Long.MAX_VALUE)
					return PropertyValue.ofNumber((long) number, source);
				return PropertyValue.ofNumber(number, source);
			case BOOLEAN:
				return PropertyValue.ofBoolean(cell.getBooleanCellValue(), source);
			case STRING:
				String text = StringUtils.trimToNull(cell.getStringCellValue());
				return text == null ? null : PropertyValue.ofString(text, source);
			default:
				// blank and error cells
				return null;
		}
	}
}
