package com.example.waterrights.application.service;

/**
 * A report file handed to the batch parser.
 *
 * @param fileName original file name, expected to look like {@code rep<no>.pdf}
 * @param content  raw PDF bytes
 */
public record ReportUpload(String fileName, byte[] content) {
}
