package com.astrophot.service;

import com.astrophot.model.PhotometryRecord;
import ij.measure.ResultsTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Map;

public class ResultsExportService {

    private static final Logger logger = LoggerFactory.getLogger(ResultsExportService.class);

    private static final int DECIMALS = 6;

    public ResultsTable toResultsTable(List<PhotometryRecord> records) {
        ResultsTable rt = new ResultsTable();
        rt.setPrecision(DECIMALS);
        rt.setNaNEmptyCells(true);
        rt.showRowNumbers(false);

        for (PhotometryRecord record : records) {
            rt.incrementCounter();
            for (Map.Entry<String, Object> e : record.toFieldMap().entrySet()) {
                Object v = e.getValue();
                if (v instanceof Number) {
                    rt.addValue(e.getKey(), ((Number) v).doubleValue());
                } else if (v instanceof Boolean) {
                    rt.addValue(e.getKey(), ((Boolean) v) ? 1 : 0);
                } else {
                    rt.addValue(e.getKey(), v == null ? "" : v.toString());
                }
            }
        }
        return rt;
    }

    // Guarda como CSV (o tabulado si la extensión no es .csv)
    public void save(List<PhotometryRecord> records, File file) throws IOException {
        ResultsTable rt = toResultsTable(records);
        rt.saveAs(file.getAbsolutePath());
        logger.info("Resultados guardados en {} ({} filas)", file.getName(), rt.size());
    }
}
