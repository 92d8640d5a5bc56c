package com.phillippitts.graphicrecorder.presentation.controller;

import com.phillippitts.graphicrecorder.service.report.MeetingReportService;
import com.phillippitts.graphicrecorder.service.report.ReportArchive;
import com.phillippitts.graphicrecorder.service.report.ReportOptions;
import org.springframework.http.CacheControl;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;

/**
 * Meeting export as a zip archive.
 */
@RestController
class ReportController {

    static final String MEDIA_MODE_HEADER = "X-Report-Media-Mode";

    private static final MediaType APPLICATION_ZIP = MediaType.parseMediaType("application/zip");

    private final MeetingReportService reports;

    ReportController(MeetingReportService reports) {
        this.reports = reports;
    }

    @GetMapping("/api/meetings/{meetingId}/report.zip")
    ResponseEntity<byte[]> report(@PathVariable String meetingId,
                                  @RequestParam(required = false) String media,
                                  @RequestParam(required = false) String captures) {
        ReportArchive archive = reports.export(meetingId, ReportOptions.fromQuery(media, captures));
        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(archive.filename(), StandardCharsets.UTF_8)
                .build();
        return ResponseEntity.ok()
                .contentType(APPLICATION_ZIP)
                .cacheControl(CacheControl.noStore())
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .header(MEDIA_MODE_HEADER, archive.mediaMode())
                .body(archive.content());
    }
}
