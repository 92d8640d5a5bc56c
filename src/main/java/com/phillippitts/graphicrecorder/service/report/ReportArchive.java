package com.phillippitts.graphicrecorder.service.report;

/**
 * A built {@code report.zip}.
 *
 * @param mediaMode {@code all}, {@code partial} or {@code none}
 */
public record ReportArchive(String filename, byte[] content, String mediaMode) {
}
