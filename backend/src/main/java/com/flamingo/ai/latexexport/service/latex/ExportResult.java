package com.flamingo.ai.latexexport.service.latex;

/**
 * Content produced by an export run together with its statistics.
 *
 * @param content reconstructed content, or the original input when the run rolled back
 * @param report run statistics
 */
public record ExportResult(String content, ExportReport report) {}
