package com.repo.scopemetrics.report;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public class CsvReporter {

    public void generate(List<DocumentReport> reports, Path outputPath) throws IOException {
        StringBuilder csv = new StringBuilder();
        // Header
        csv.append("File,Line,Column,Rule,Name,Metric,Max,Message\n");

        // Rows
        for (DocumentReport report : reports) {
            for (Violation v : report.violations()) {
                csv.append(String.format("%s,%d,%d,%s,%s,%d,%d,%s\n",
                        escape(report.document()),
                        v.position().line(),
                        v.position().column(),
                        v.ruleId(),
                        escape(v.name()),
                        metricOf(v),
                        v.intData("max", 0),
                        escape(v.message())));
            }
        }

        Files.writeString(outputPath, csv.toString());
        System.out.println("CSV Report generated at: " + outputPath.toAbsolutePath());
    }

    private static int metricOf(Violation v) {
        // complexity reports "complexity", max-statements reports "count"
        return v.intData("complexity", v.intData("count", 0));
    }

    private String escape(String s) {
        if (s == null)
            return "";
        if (s.contains(",") || s.contains("\"") || s.contains("\n") || s.contains("\r")) {
            return "\"" + s.replace("\"", "\"\"") + "\"";
        }
        return s;
    }
}
